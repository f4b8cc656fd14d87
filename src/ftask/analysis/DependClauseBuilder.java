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
 * Computes the five clause sets of a task region from its body. Statements
 * are visited in source order: for an assignment the right-hand side is
 * read before the left-hand side is written, for a loop the bounds are read
 * and the loop variable becomes private, and for an if block the condition
 * is read before both branches are visited. The first rejection aborts the
 * whole computation; no partial result is returned.
 */
public class DependClauseBuilder
{
  private final SymbolResolver mResolver;
  private final TaskClauseConfig mConfig;

  public DependClauseBuilder(SymbolResolver resolver, TaskClauseConfig config)
  {
    mResolver = resolver;
    mConfig = config;
  }

  /**
   * @param task the task region; it is not modified
   * @return the finished clause sets
   * @throws TaskClauseException on the first construct that cannot be
   * handled soundly
   */
  public ClauseSets computeClauses(TaskRegion task) throws TaskClauseException
  {
    LoopContext context = new LoopContext(task);
    ClauseSets sets = new ClauseSets();
    AccessClassifier classifier = new AccessClassifier(context, mResolver, mConfig, sets);
    evaluateStatement(context.getTopLoop(), classifier, sets);
    return sets;
  }

  private void evaluateStatement(Statement stmt, AccessClassifier classifier,
                                 ClauseSets sets)
    throws TaskClauseException
  {
    if (stmt instanceof CompoundStatement) {
      for (Statement child : ((CompoundStatement)stmt).getStatements())
        evaluateStatement(child, classifier, sets);
    }
    else if (stmt instanceof DoLoop) {
      evaluateLoop((DoLoop)stmt, classifier, sets);
    }
    else if (stmt instanceof IfStatement) {
      IfStatement ifStmt = (IfStatement)stmt;
      readAll(ifStmt.getControlExpression(), classifier, stmt);
      evaluateStatement(ifStmt.getThenStatement(), classifier, sets);
      if (ifStmt.getElseStatement() != null)
        evaluateStatement(ifStmt.getElseStatement(), classifier, sets);
    }
    else if (stmt instanceof ExpressionStatement
             && ((ExpressionStatement)stmt).getExpression() instanceof AssignmentExpression) {
      evaluateAssignment((AssignmentExpression)((ExpressionStatement)stmt).getExpression(),
                         classifier, stmt);
    }
    else {
      throw new TaskClauseException(TaskClauseException.Reason.MALFORMED_TASK_BODY,
                                    "unsupported statement in task body",
                                    stmt, stmt);
    }
  }

  private void evaluateLoop(DoLoop loop, AccessClassifier classifier, ClauseSets sets)
    throws TaskClauseException
  {
    readAll(loop.getStart(), classifier, loop);
    readAll(loop.getStop(), classifier, loop);
    readAll(loop.getStep(), classifier, loop);
    Symbol var = loop.getIndexVariable().getSymbol();
    if (!sets.contains(ClauseType.FIRSTPRIVATE, var))
      sets.addSymbol(ClauseType.PRIVATE, var);
    evaluateStatement(loop.getBody(), classifier, sets);
  }

  private void evaluateAssignment(AssignmentExpression assign,
                                  AccessClassifier classifier, Statement stmt)
    throws TaskClauseException
  {
    Expression lhs = assign.getLHS();
    if (SymbolTools.getSymbolOf(lhs) == null)
      throw new TaskClauseException(TaskClauseException.Reason.MALFORMED_TASK_BODY,
                                    "left-hand side is not a variable",
                                    stmt, lhs);
    readAll(assign.getRHS(), classifier, stmt);
    AccessType type = assign.getRHS().findExpression(lhs).isEmpty()
      ? AccessType.WRITE : AccessType.READWRITE;
    classifier.classify(lhs, type, stmt);
  }

  private void readAll(Expression e, AccessClassifier classifier, Statement stmt)
    throws TaskClauseException
  {
    for (Expression ref : AccessClassifier.collectReferences(e))
      classifier.classify(ref, AccessType.READ, stmt);
  }
}
