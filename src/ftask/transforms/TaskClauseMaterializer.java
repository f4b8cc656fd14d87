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

package ftask.transforms;

import java.util.*;

import ftask.analysis.*;
import ftask.exec.TaskClauseConfig;
import ftask.hir.*;

/**
 * Attaches freshly computed clauses to a task region. The clauses are
 * computed completely before anything is attached, then all five slots are
 * swapped in one step; on a rejection the previous clauses stay in place.
 * Running it twice on an unchanged body yields equal clauses.
 */
public class TaskClauseMaterializer
{
  private TaskClauseMaterializer()
  {
  }

  /**
   * Computes the clause sets of the task with the default resolver.
   */
  public static ClauseSets computeClauses(TaskRegion task, TaskClauseConfig config)
    throws TaskClauseException
  {
    return computeClauses(task, config, new RegionSymbolResolver());
  }

  public static ClauseSets computeClauses(TaskRegion task, TaskClauseConfig config,
                                          SymbolResolver resolver)
    throws TaskClauseException
  {
    return new DependClauseBuilder(resolver, config).computeClauses(task);
  }

  /**
   * Recomputes and attaches the clauses of the task.
   *
   * @return the attached clauses in slot order
   * @throws TaskClauseException if the clauses cannot be inferred; the task
   * is left unchanged
   */
  public static List<Clause> materialize(TaskRegion task, TaskClauseConfig config)
    throws TaskClauseException
  {
    return materialize(task, config, new RegionSymbolResolver());
  }

  public static List<Clause> materialize(TaskRegion task, TaskClauseConfig config,
                                         SymbolResolver resolver)
    throws TaskClauseException
  {
    task.setClauses(computeClauses(task, config, resolver).toClauses());
    return task.getClauses();
  }
}
