//============================================================================//
//    FCUDA
//    Copyright (c) <2016> 
//    <University of Illinois at Urbana-Champaign>
//    <University of California at Los Angeles> 
//    All rights reserved.
// 
//    Developed by:
// 
//        <ES CAD Group & IMPACT Research Group>
//            <University of Illinois at Urbana-Champaign>
//            <http://dchen.ece.illinois.edu/>
//            <http://impact.crhc.illinois.edu/>
// 
//        <VAST Laboratory>
//            <University of California at Los Angeles>
//            <http://vast.cs.ucla.edu/>
// 
//        <Hardware Research Group>
//            <Advanced Digital Sciences Center>
//            <http://adsc.illinois.edu/>
//============================================================================//

package ftask.analysis;

import java.util.*;

import ftask.hir.*;

/**
 * Classifies a single array subscript against the set of loop variables in
 * scope. Only literals, bare references and a reference plus or minus a
 * literal are accepted; everything else is rejected rather than
 * approximated.
 */
public class IndexClassifier
{
  private IndexClassifier()
  {
  }

  /**
   * @param index the subscript expression
   * @param inductionVars the loop variables in scope: the task's own loop
   * variables and those of the loops enclosing the task
   * @return the classification of the subscript
   * @throws TaskClauseException with reason UNSUPPORTED_INDEX_FORM for any
   * other shape, including literal minus loop variable
   */
  public static IndexClass classify(Expression index, Set<Symbol> inductionVars)
    throws TaskClauseException
  {
    if (index instanceof IntegerLiteral)
      return new IndexClass.Constant(null);

    if (index instanceof Identifier) {
      Symbol var = ((Identifier)index).getSymbol();
      if (inductionVars.contains(var))
        return new IndexClass.Induction(var);
      return new IndexClass.Constant(var);
    }

    if (index instanceof BinaryExpression) {
      BinaryExpression bexpr = (BinaryExpression)index;
      BinaryOperator op = bexpr.getOperator();
      if (!op.isAdditive())
        throw unsupported(index, "operator " + op.toString().trim()
                          + " is not allowed in a task subscript");

      Expression lhs = bexpr.getLHS();
      Expression rhs = bexpr.getRHS();
      if (lhs instanceof Identifier && rhs instanceof IntegerLiteral) {
        Symbol var = ((Identifier)lhs).getSymbol();
        long offset = ((IntegerLiteral)rhs).getValue();
        if (inductionVars.contains(var))
          return new IndexClass.AffineOffset(var, op, offset, false);
        return new IndexClass.Constant(var);
      }
      if (lhs instanceof IntegerLiteral && rhs instanceof Identifier) {
        Symbol var = ((Identifier)rhs).getSymbol();
        long offset = ((IntegerLiteral)lhs).getValue();
        if (!inductionVars.contains(var))
          return new IndexClass.Constant(var);
        // k-i runs against the loop direction
        if (op == BinaryOperator.SUBTRACT)
          throw unsupported(index, "loop variable " + var.getSymbolName()
                            + " is subtracted from a literal");
        return new IndexClass.AffineOffset(var, op, offset, true);
      }
      throw unsupported(index, "expected one reference and one literal");
    }

    throw unsupported(index, index.getClass().getSimpleName()
                      + " is not allowed in a task subscript");
  }

  private static TaskClauseException unsupported(Expression index, String msg)
  {
    return new TaskClauseException(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM,
                                   msg, index.getStatement(), index);
  }
}
