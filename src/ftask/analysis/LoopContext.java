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
 * Loop structure around and inside one task region: the task's own loops,
 * the chunked parent loop and the loops enclosing the task, and the task
 * loops that stand in for the parent loop variable.
 */
public class LoopContext
{
  private final ParallelRegion mRegion;
  private final DoLoop mTopLoop;
  private final Set<Symbol> mTaskLoopVars;
  private final DoLoop mParentLoop;
  private final Set<Symbol> mAncestorLoopVars;
  private final Map<Symbol, Symbol> mProxies;

  /**
   * @param task the task region being analyzed
   * @throws TaskClauseException MISSING_ENCLOSING_REGION if the task is not
   * inside a parallel region, MALFORMED_TASK_BODY if the body is not a
   * single loop
   */
  public LoopContext(TaskRegion task) throws TaskClauseException
  {
    mRegion = IRTools.getAncestorOfType(task, ParallelRegion.class);
    if (mRegion == null)
      throw new TaskClauseException(TaskClauseException.Reason.MISSING_ENCLOSING_REGION,
                                    "task region is not inside a parallel region",
                                    task, null);

    List<Statement> stmts = task.getBody().getStatements();
    if (stmts.size() != 1 || !(stmts.get(0) instanceof DoLoop))
      throw new TaskClauseException(TaskClauseException.Reason.MALFORMED_TASK_BODY,
                                    "task body must be a single loop but has "
                                    + stmts.size() + " statement(s)",
                                    task, stmts.isEmpty() ? null : stmts.get(0));
    mTopLoop = (DoLoop)stmts.get(0);

    mTaskLoopVars = new LinkedHashSet<Symbol>();
    for (DoLoop loop : new DFIterator<DoLoop>(mTopLoop, DoLoop.class).getList())
      mTaskLoopVars.add(loop.getIndexVariable().getSymbol());

    DoLoop parent = IRTools.getAncestorOfType(task, DoLoop.class);
    mParentLoop = (parent != null && IRTools.isAncestorOf(mRegion, parent)) ? parent : null;

    // Loops outside the parallel region do not relate to the task's indices.
    mAncestorLoopVars = new LinkedHashSet<Symbol>();
    for (DoLoop loop = parent; loop != null && IRTools.isAncestorOf(mRegion, loop);
         loop = IRTools.getAncestorOfType(loop, DoLoop.class))
      mAncestorLoopVars.add(loop.getIndexVariable().getSymbol());

    mProxies = new HashMap<Symbol, Symbol>();
    if (mParentLoop != null) {
      Symbol pvar = mParentLoop.getIndexVariable().getSymbol();
      for (DoLoop loop : new DFIterator<DoLoop>(mTopLoop, DoLoop.class).getList()) {
        Expression start = loop.getStart();
        if (start instanceof Identifier && ((Identifier)start).getSymbol() == pvar)
          mProxies.put(loop.getIndexVariable().getSymbol(), pvar);
      }
    }
  }

  public ParallelRegion getRegion()
  {
    return mRegion;
  }

  public DoLoop getTopLoop()
  {
    return mTopLoop;
  }

  /** The nearest loop enclosing the task inside the parallel region, or null. */
  public DoLoop getParentLoop()
  {
    return mParentLoop;
  }

  public Symbol getParentLoopVar()
  {
    return (mParentLoop == null) ? null : mParentLoop.getIndexVariable().getSymbol();
  }

  public boolean isTaskLoopVar(Symbol s)
  {
    return mTaskLoopVars.contains(s);
  }

  public boolean isAncestorLoopVar(Symbol s)
  {
    return mAncestorLoopVars.contains(s);
  }

  /** Checks if the task loop variable starts at the parent loop variable. */
  public boolean isProxy(Symbol s)
  {
    return mProxies.containsKey(s);
  }

  /** Checks if the symbol is the parent loop variable or a proxy for it. */
  public boolean isChunkedVar(Symbol s)
  {
    return isProxy(s) || (s != null && s == getParentLoopVar());
  }

  /**
   * Every loop variable an index may be related to: the task's own loops
   * and the loops between the task and its parallel region.
   */
  public Set<Symbol> getInductionVars()
  {
    Set<Symbol> ret = new LinkedHashSet<Symbol>(mTaskLoopVars);
    ret.addAll(mAncestorLoopVars);
    return ret;
  }

  /**
   * Returns the parent loop step as a non-zero literal.
   *
   * @throws TaskClauseException NON_LITERAL_STEP_UNSUPPORTED otherwise
   */
  public long getParentStep(Statement where) throws TaskClauseException
  {
    Expression step = mParentLoop.getStep();
    long value = 0;
    if (step instanceof IntegerLiteral)
      value = ((IntegerLiteral)step).getValue();
    else if (step instanceof UnaryExpression
             && ((UnaryExpression)step).getOperator() == UnaryOperator.MINUS
             && ((UnaryExpression)step).getExpression() instanceof IntegerLiteral)
      value = -((IntegerLiteral)((UnaryExpression)step).getExpression()).getValue();
    else
      throw new TaskClauseException(TaskClauseException.Reason.NON_LITERAL_STEP_UNSUPPORTED,
                                    "step " + step + " of loop over "
                                    + getParentLoopVar() + " is not a literal",
                                    where, step);
    if (value == 0)
      throw new TaskClauseException(TaskClauseException.Reason.NON_LITERAL_STEP_UNSUPPORTED,
                                    "step of loop over " + getParentLoopVar() + " is zero",
                                    where, step);
    return value;
  }
}
