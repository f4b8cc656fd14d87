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

package ftask.exec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CommandLineOptionSetTests
{
  @Test
  public void storesValuesByName()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "alpha", "1", "0|1", "Enable alpha");
    options.add("beta", "Flag without value");

    assertTrue(options.contains("alpha"));
    assertEquals("1", options.getValue("alpha"));
    assertNull(options.getValue("beta"));
    assertEquals(options.ANALYSIS, options.getType("alpha"));
    assertEquals(options.UTILITY, options.getType("beta"));
    assertEquals(0, options.getType("gamma"));

    options.setValue("beta", "x");
    options.setValue("gamma", "y");
    assertEquals("x", options.getValue("beta"));
    assertFalse(options.contains("gamma"));
  }

  @Test
  public void usageIsGroupedByType()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.CODEGEN, "zeta", "name", "Last option");
    options.add(options.ANALYSIS, "alpha", "1", "0|1", "First option");

    String usage = options.getUsage();
    assertTrue(usage.indexOf("ANALYSIS") < usage.indexOf("CODEGEN"));
    assertFalse(usage.contains("TRANSFORM"));
    assertTrue(options.getUsage(options.ANALYSIS).startsWith("-alpha=0|1\n    First option\n"));
  }

  @Test
  public void dumpUsesOptionsFileFormat()
  {
    CommandLineOptionSet options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "alpha", "1", "0|1", "First option");
    assertEquals("#Option: alpha\n#alpha=0|1\n#First option\nalpha=1\n",
                 options.dumpOptions());
  }
}
