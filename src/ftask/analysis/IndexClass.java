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

import ftask.hir.*;

/**
 * Result of classifying one array subscript. The variants are closed: the
 * only subclasses are the nested ones, and {@link #getKind()} names which
 * one an instance is.
 */
public abstract class IndexClass
{
  public enum Kind
  {
    INDUCTION,
    AFFINE_OFFSET,
    CONSTANT
  }

  private IndexClass()
  {
  }

  public abstract Kind getKind();

  /**
   * The symbol the subscript refers to, or null for a literal subscript.
   */
  public abstract Symbol getSymbol();

  /**
   * A bare reference to a loop variable in scope, a(i).
   */
  public static final class Induction extends IndexClass
  {
    private final Symbol mVar;

    public Induction(Symbol var)
    {
      mVar = var;
    }

    public Kind getKind()
    {
      return Kind.INDUCTION;
    }

    public Symbol getSymbol()
    {
      return mVar;
    }

    public String toString()
    {
      return "Induction(" + mVar + ")";
    }
  }

  /**
   * A loop variable in scope plus or minus a literal, a(i+1) or a(1+i).
   */
  public static final class AffineOffset extends IndexClass
  {
    private final Symbol mVar;
    private final BinaryOperator mOp;
    private final long mOffset;
    private final boolean mLiteralFirst;

    /**
     * @param var the loop variable
     * @param op either ADD or SUBTRACT
     * @param offset the literal operand
     * @param literalFirst true for the form literal op var
     */
    public AffineOffset(Symbol var, BinaryOperator op, long offset,
                        boolean literalFirst)
    {
      if (!op.isAdditive())
        throw new IllegalArgumentException("not an additive operator: " + op);
      mVar = var;
      mOp = op;
      mOffset = offset;
      mLiteralFirst = literalFirst;
    }

    public Kind getKind()
    {
      return Kind.AFFINE_OFFSET;
    }

    public Symbol getSymbol()
    {
      return mVar;
    }

    public BinaryOperator getOperator()
    {
      return mOp;
    }

    public long getOffset()
    {
      return mOffset;
    }

    public boolean isLiteralFirst()
    {
      return mLiteralFirst;
    }

    public String toString()
    {
      return "AffineOffset(" + mVar + mOp + mOffset + ")";
    }
  }

  /**
   * A subscript that does not change while the task runs: a literal, a
   * variable with no loop relationship, or such a variable plus or minus a
   * literal.
   */
  public static final class Constant extends IndexClass
  {
    private final Symbol mVar;

    /**
     * @param var the referenced variable, or null for a literal
     */
    public Constant(Symbol var)
    {
      mVar = var;
    }

    public Kind getKind()
    {
      return Kind.CONSTANT;
    }

    public Symbol getSymbol()
    {
      return mVar;
    }

    public String toString()
    {
      return (mVar == null) ? "Constant" : "Constant(" + mVar + ")";
    }
  }
}
