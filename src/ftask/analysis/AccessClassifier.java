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

import ftask.exec.TaskClauseConfig;
import ftask.hir.*;

/**
 * Classifies single references inside a task body and records the result in
 * the running clause sets. A reference to a variable that is private in the
 * parallel region becomes private in the task on its first write and
 * firstprivate otherwise. A reference to a shared variable becomes a
 * dependency term, with one term per combination of the subscript
 * alternatives computed for each dimension.
 */
public class AccessClassifier
{
  private final LoopContext mContext;
  private final SymbolResolver mResolver;
  private final TaskClauseConfig mConfig;
  private final ClauseSets mSets;

  public AccessClassifier(LoopContext context, SymbolResolver resolver,
                          TaskClauseConfig config, ClauseSets sets)
  {
    mContext = context;
    mResolver = resolver;
    mConfig = config;
    mSets = sets;
  }

  /**
   * Returns the outermost references of an expression in source order:
   * identifiers, array accesses and component accesses. Subscripts of the
   * returned array accesses and the names of called functions are not
   * included.
   */
  public static List<Expression> collectReferences(Expression e)
  {
    List<Expression> ret = new ArrayList<Expression>();
    collectReferences(e, ret);
    return ret;
  }

  private static void collectReferences(Expression e, List<Expression> ret)
  {
    if (e instanceof Identifier || e instanceof ArrayAccess
        || e instanceof AccessExpression) {
      ret.add(e);
    } else if (e instanceof FunctionCall) {
      FunctionCall call = (FunctionCall)e;
      for (int i = 0; i < call.getNumArguments(); i++)
        collectReferences(call.getArgument(i), ret);
    } else {
      for (Traversable t : e.getChildren())
        collectReferences((Expression)t, ret);
    }
  }

  /**
   * Classifies one reference and updates the clause sets.
   *
   * @param ref an identifier, array access or component access
   * @param type how the statement accesses the reference
   * @param stmt the statement containing the reference
   * @throws TaskClauseException if a subscript cannot be handled
   */
  public void classify(Expression ref, AccessType type, Statement stmt)
    throws TaskClauseException
  {
    if (type == AccessType.READWRITE) {
      classify(ref, AccessType.READ, stmt);
      classify(ref, AccessType.WRITE, stmt);
      return;
    }
    Symbol sym = SymbolTools.getSymbolOf(ref);
    if (sym == null)
      throw new InternalError("not a reference: " + ref);

    List<Expression> indices = getSubscripts(ref);
    if (isRegionPrivate(sym)) {
      if (!mSets.isTaskLocal(sym)) {
        ClauseType dest = (type == AccessType.WRITE) ? ClauseType.PRIVATE
                                                     : ClauseType.FIRSTPRIVATE;
        mSets.addSymbol(dest, sym);
        PrintTools.printlnStatus(3, "[AccessClassifier]", type, ref, "->", dest);
      }
      for (Expression index : indices)
        for (Expression r : collectReferences(index))
          classify(r, AccessType.READ, stmt);
      return;
    }

    if (indices.isEmpty()) {
      // Loop variables and earlier private writes live in the task.
      if (mSets.isTaskLocal(sym))
        return;
      ClauseType dest = (type == AccessType.WRITE) ? ClauseType.DEPEND_OUT
                                                   : ClauseType.DEPEND_IN;
      mSets.addSymbol(dest, sym);
      mSets.addSymbol(ClauseType.SHARED, sym);
      PrintTools.printlnStatus(3, "[AccessClassifier]", type, ref, "->", dest);
      return;
    }

    List<List<Expression>> alternatives = new ArrayList<List<Expression>>();
    for (int dim = 0; dim < indices.size(); dim++)
      alternatives.add(resolveDimension(sym, dim, indices.get(dim), stmt));

    ClauseType dest = (type == AccessType.WRITE) ? ClauseType.DEPEND_OUT
                                                 : ClauseType.DEPEND_IN;
    for (List<Expression> combination : cartesianProduct(alternatives)) {
      List<Expression> copies = new ArrayList<Expression>(combination.size());
      for (Expression e : combination)
        copies.add(e.clone());
      ArrayAccess term = new ArrayAccess(new Identifier(sym), copies);
      mSets.add(dest, term);
      PrintTools.printlnStatus(3, "[AccessClassifier]", type, ref, "->", dest, term);
    }
    mSets.addSymbol(ClauseType.SHARED, sym);
  }

  /**
   * Computes the alternatives of one dimension of a dependency term. Most
   * dimensions have one alternative; an offset on the chunked parent loop
   * variable that is not a multiple of the step has two.
   */
  List<Expression> resolveDimension(Symbol array, int dim, Expression index,
                                    Statement stmt)
    throws TaskClauseException
  {
    IndexClass ic = IndexClassifier.classify(index, mContext.getInductionVars());
    PrintTools.printlnStatus(3, "[AccessClassifier]", array + "(" + index + ")",
                             "dimension", dim + 1, "is", ic);
    Symbol var = ic.getSymbol();
    switch (ic.getKind()) {
    case CONSTANT:
      if (var != null)
        requireTaskLocalIndex(var, index, stmt);
      return Collections.singletonList(index);

    case INDUCTION:
      if (mContext.isChunkedVar(var)) {
        Symbol pvar = mContext.getParentLoopVar();
        requireTaskLocalIndex(pvar, index, stmt);
        return Collections.<Expression>singletonList(new Identifier(pvar));
      }
      return loopIndex(array, dim, var, index, stmt);

    case AFFINE_OFFSET:
      if (mContext.isChunkedVar(var))
        return expandChunkedOffset((IndexClass.AffineOffset)ic, index, stmt);
      return loopIndex(array, dim, var, index, stmt);

    default:
      throw new InternalError("unhandled index class " + ic);
    }
  }

  // Index on a task loop variable or on a loop enclosing the task.
  private List<Expression> loopIndex(Symbol array, int dim, Symbol var,
                                     Expression index, Statement stmt)
    throws TaskClauseException
  {
    if (mContext.isTaskLoopVar(var)) {
      if (isRegionPrivate(var))
        return Collections.<Expression>singletonList(fullRange(array, dim));
      return Collections.singletonList(index);
    }
    requireTaskLocalIndex(var, index, stmt);
    return Collections.singletonList(index);
  }

  /**
   * Relates an offset on the parent loop variable to the parent step:
   * with d = ceil(|k|/|s|) the term is v op d*|s|, plus v op (d-1)*|s| when
   * |k| is not a multiple of |s|.
   */
  private List<Expression> expandChunkedOffset(IndexClass.AffineOffset ic,
                                               Expression index, Statement stmt)
    throws TaskClauseException
  {
    Symbol pvar = mContext.getParentLoopVar();
    requireTaskLocalIndex(pvar, index, stmt);
    long step = mContext.getParentStep(stmt);
    long k = ic.getOffset();
    if (step == Long.MIN_VALUE || k == Long.MIN_VALUE)
      throw new TaskClauseException(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM,
                                    "offset or step of " + index + " is out of range",
                                    stmt, index);
    step = Math.abs(step);
    BinaryOperator op = ic.getOperator();
    boolean literalFirst = ic.isLiteralFirst();
    if (k < 0) {
      k = -k;
      op = (op == BinaryOperator.ADD) ? BinaryOperator.SUBTRACT : BinaryOperator.ADD;
    }
    // k+v keeps its order; a subtraction always reads v-k
    if (op == BinaryOperator.SUBTRACT)
      literalFirst = false;
    long d = k / step + ((k % step != 0) ? 1 : 0);
    long amount;
    try {
      amount = Math.multiplyExact(d, step);
    } catch (ArithmeticException e) {
      throw new TaskClauseException(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM,
                                    "offset of " + index + " is out of range",
                                    stmt, index);
    }
    List<Expression> ret = new ArrayList<Expression>(2);
    ret.add(offsetTerm(pvar, op, amount, literalFirst));
    if (k % step != 0)
      ret.add(offsetTerm(pvar, op, amount - step, literalFirst));
    return ret;
  }

  private static Expression offsetTerm(Symbol var, BinaryOperator op,
                                       long amount, boolean literalFirst)
  {
    if (amount == 0)
      return new Identifier(var);
    if (literalFirst)
      return new BinaryExpression(new IntegerLiteral(amount), op, new Identifier(var));
    return new BinaryExpression(new Identifier(var), op, new IntegerLiteral(amount));
  }

  /** Builds LBOUND(a,d):UBOUND(a,d) for the zero-based dimension. */
  private Expression fullRange(Symbol array, int dim)
  {
    List<Expression> lbArgs = new ArrayList<Expression>(2);
    lbArgs.add(new Identifier(array));
    lbArgs.add(new IntegerLiteral(dim + 1));
    List<Expression> ubArgs = new ArrayList<Expression>(2);
    ubArgs.add(new Identifier(array));
    ubArgs.add(new IntegerLiteral(dim + 1));
    return new RangeExpression(
      new FunctionCall(new NameID(mConfig.getLBoundName()), lbArgs),
      new FunctionCall(new NameID(mConfig.getUBoundName()), ubArgs));
  }

  private void requireTaskLocalIndex(Symbol var, Expression index, Statement stmt)
    throws TaskClauseException
  {
    if (mSets.isTaskLocal(var))
      return;
    if (!isRegionPrivate(var))
      throw new TaskClauseException(TaskClauseException.Reason.SHARED_USED_AS_INDEX,
                                    "shared variable " + var.getSymbolName()
                                    + " is used as an index",
                                    stmt, index);
    mSets.addSymbol(ClauseType.FIRSTPRIVATE, var);
  }

  private boolean isRegionPrivate(Symbol sym)
  {
    return mResolver.isPrivateInEnclosingRegion(sym, mContext.getRegion());
  }

  // The subscripts that select the accessed element of the base variable.
  private static List<Expression> getSubscripts(Expression ref)
  {
    Expression base = ref;
    if (base instanceof AccessExpression)
      base = ((AccessExpression)base).getRootBase();
    if (base instanceof ArrayAccess)
      return ((ArrayAccess)base).getIndices();
    return Collections.emptyList();
  }

  private static List<List<Expression>> cartesianProduct(List<List<Expression>> dims)
  {
    List<List<Expression>> ret = new ArrayList<List<Expression>>();
    ret.add(new ArrayList<Expression>());
    for (List<Expression> alternatives : dims) {
      List<List<Expression>> next = new ArrayList<List<Expression>>();
      for (List<Expression> prefix : ret) {
        for (Expression alt : alternatives) {
          List<Expression> combination = new ArrayList<Expression>(prefix);
          combination.add(alt);
          next.add(combination);
        }
      }
      ret = next;
    }
    return ret;
  }
}
