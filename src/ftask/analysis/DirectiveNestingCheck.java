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
 * Checks the placement of every directive region: no parallel region inside
 * another, serial regions inside a parallel region and not inside each
 * other, task regions inside a serial region. Violations are reported and
 * collected; the IR is not changed.
 */
public class DirectiveNestingCheck extends AnalysisPass
{
  private final List<TaskClauseException> mFailures;

  public DirectiveNestingCheck(Program program)
  {
    super(program);
    mFailures = new ArrayList<TaskClauseException>();
  }

  public String getPassName()
  {
    return "[DirectiveNestingCheck]";
  }

  public void start()
  {
    mFailures.clear();
    DFIterator<DirectiveRegion> iter =
      new DFIterator<DirectiveRegion>(program, DirectiveRegion.class);
    while (iter.hasNext()) {
      DirectiveRegion region = iter.next();
      try {
        region.validateGlobalConstraints();
      } catch (TaskClauseException e) {
        mFailures.add(e);
        PrintTools.printlnStatus(0, getPassName(), e.describe());
      }
    }
  }

  /** The nesting violations found by the last run, in source order. */
  public List<TaskClauseException> getFailures()
  {
    return Collections.unmodifiableList(mFailures);
  }
}
