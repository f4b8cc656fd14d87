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
 * Base class of the analysis passes. Each run is timed and followed by a
 * consistency check of the IR.
 */
public abstract class AnalysisPass
{
  protected Program program;

  protected AnalysisPass(Program program)
  {
    this.program = program;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.printlnStatus(1, pass.getPassName(), "begin");
    pass.start();
    PrintTools.printlnStatus(1, pass.getPassName(), "end in",
                             String.format("%.2f seconds", Tools.getTime(timer)));
    if (!IRTools.checkConsistency(pass.program))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  public abstract void start();
}
