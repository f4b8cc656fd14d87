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

import ftask.hir.*;

/**
 * Base class of all transformation passes. For consistent compilation, the
 * IR is checked at the end of every transformation pass.
 */
public abstract class TransformPass
{
  /** The associated program */
  protected Program program;

  /** Flags for skipping consistency checking */
  protected boolean disable_protection;

  protected TransformPass(Program program)
  {
    this.program = program;
    disable_protection = false;
  }

  /** Returns the name of the transform pass */
  public abstract String getPassName();

  /**
   * Invokes the specified transform pass.
   * @param pass the transform pass that is to be run.
   */
  public static void run(TransformPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.printlnStatus(1, pass.getPassName(), "begin");
    pass.start();
    PrintTools.printlnStatus(1, pass.getPassName(), "end in",
                             String.format("%.2f seconds", Tools.getTime(timer)));
    if (!pass.disable_protection && !IRTools.checkConsistency(pass.program))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  /** Starts a transform pass */
  public abstract void start();
}
