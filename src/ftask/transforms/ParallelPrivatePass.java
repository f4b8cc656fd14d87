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

import ftask.analysis.ParallelPrivatization;
import ftask.hir.*;

/**
 * Replaces the private clause of every parallel region with the one computed
 * by {@link ParallelPrivatization}. Runs before task clause inference since
 * task classification reads the region private set.
 */
public class ParallelPrivatePass extends TransformPass
{
  public ParallelPrivatePass(Program program)
  {
    super(program);
  }

  public String getPassName()
  {
    return "[ParallelPrivatePass]";
  }

  public void start()
  {
    DFIterator<ParallelRegion> iter =
      new DFIterator<ParallelRegion>(program, ParallelRegion.class);
    while (iter.hasNext()) {
      ParallelRegion region = iter.next();
      Clause clause = new ParallelPrivatization(region).computePrivateClause();
      region.setPrivateClause(clause);
      PrintTools.printlnStatus(2, getPassName(), region.getDirectiveText());
    }
  }
}
