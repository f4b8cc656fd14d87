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
 * Infers the clauses of every task region of the program in source order.
 * A task whose clauses cannot be inferred keeps its previous clauses; the
 * rejection is reported and kept in {@link #getFailures()}.
 */
public class TaskClausePass extends TransformPass
{
  private final TaskClauseConfig mConfig;
  private final SymbolResolver mResolver;
  private final List<TaskClauseException> mFailures;
  private int mNumTasks;

  public TaskClausePass(Program program, TaskClauseConfig config)
  {
    this(program, config, new RegionSymbolResolver());
  }

  public TaskClausePass(Program program, TaskClauseConfig config,
                        SymbolResolver resolver)
  {
    super(program);
    mConfig = config;
    mResolver = resolver;
    mFailures = new ArrayList<TaskClauseException>();
  }

  public String getPassName()
  {
    return "[TaskClausePass]";
  }

  public void start()
  {
    mFailures.clear();
    mNumTasks = 0;
    List<TaskRegion> tasks = new DFIterator<TaskRegion>(program, TaskRegion.class).getList();
    for (TaskRegion task : tasks) {
      mNumTasks++;
      task.setSentinel(mConfig.getSentinel());
      try {
        TaskClauseMaterializer.materialize(task, mConfig, mResolver);
        PrintTools.printlnStatus(2, getPassName(), task.getSentinel(),
                                 task.getDirectiveText());
      } catch (TaskClauseException e) {
        mFailures.add(e);
        PrintTools.printlnStatus(0, getPassName(), e.describe());
      }
    }
    PrintTools.printlnStatus(1, getPassName(), mNumTasks - mFailures.size(), "of",
                             mNumTasks, "task(s) annotated");
  }

  /** The rejections of the last run, in source order. */
  public List<TaskClauseException> getFailures()
  {
    return Collections.unmodifiableList(mFailures);
  }

  /** The number of task regions visited by the last run. */
  public int getNumTasks()
  {
    return mNumTasks;
  }
}
