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

import static ftask.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ftask.KernelFixtures;
import ftask.analysis.TaskClauseException;
import ftask.hir.*;

public class DriverTests
{
  private KernelFixtures k;
  private TaskRegion task;

  @BeforeEach
  public void buildRecurrence()
  {
    k = new KernelFixtures();
    VariableSymbol c = k.array("c", 1);
    VariableSymbol d = k.scalar("d");
    VariableSymbol i = k.scalar("i");
    task = k.placeTask(task(
      loop(i, lit(1), lit(10),
           assign(at(c, id(i)),
                  new BinaryExpression(at(c, minus(i, 1)), BinaryOperator.ADD, id(d))))),
      privates());
  }

  @AfterEach
  public void resetVerbosity()
  {
    PrintTools.setVerbosity(0);
  }

  @Test
  public void defaultRunPrivatizesThenInfers()
  {
    Driver driver = new Driver();
    String out = driver.run(new String[0], k.program);

    assertTrue(driver.getFailures().isEmpty());
    assertTrue(out.startsWith("subroutine kernel\n"));
    assertTrue(out.contains("\n  !$omp parallel default(shared) private(i)\n"));
    assertTrue(out.contains("\n  !$omp task private(i) shared(c, d) "
                            + "depend(in: c(LBOUND(c,1):UBOUND(c,1)), d) "
                            + "depend(out: c(LBOUND(c,1):UBOUND(c,1)))\n"));
    assertTrue(out.contains("\n    c(i) = c(i-1)+d\n"));
    assertTrue(out.endsWith("  !$omp end parallel\nend subroutine kernel\n"));
  }

  @Test
  public void optionsSelectPassesAndNames()
  {
    Driver driver = new Driver();
    String out = driver.run(new String[] {
        "-parallel-private=0", "-sentinel=!$", "-lbound=lbound", "-verbosity=1" },
      k.program);

    assertEquals("0", driver.getOptionValue("parallel-private"));
    assertTrue(out.contains("\n  !$omp parallel default(shared)\n"));
    assertTrue(out.contains("\n  !$omp task private(i) shared(c, d) "
                            + "depend(in: c(i-1), d) depend(out: c(i))\n"));
    assertEquals(1, PrintTools.getVerbosity());
  }

  @Test
  public void taskClausesCanBeDisabled()
  {
    Driver driver = new Driver();
    driver.run(new String[] { "-task-clauses=0" }, k.program);
    assertEquals("omp task", task.getDirectiveText());
  }

  @Test
  public void helpLeavesProgramAlone()
  {
    Driver driver = new Driver();
    String out = driver.run(new String[] { "-help" }, k.program);
    assertTrue(out.contains("-verbosity=N"));
    assertTrue(out.contains("-task-clauses=0|1"));
    assertEquals("omp task", task.getDirectiveText());

    out = new Driver().run(new String[] { "-dump-options" }, k.program);
    assertTrue(out.contains("\nverbosity=0\n"));
  }

  @Test
  public void failuresAreCollected()
  {
    VariableSymbol i = (VariableSymbol)k.routine.findLocalSymbol("i");
    TaskRegion stray = task(loop(i, lit(1), lit(2)));
    k.add(stray);

    Driver driver = new Driver();
    driver.run(new String[0], k.program);
    assertEquals(2, driver.getFailures().size());
    assertSame(TaskClauseException.Reason.INVALID_NESTING,
               driver.getFailures().get(0).getReason());
    assertSame(TaskClauseException.Reason.MISSING_ENCLOSING_REGION,
               driver.getFailures().get(1).getReason());
  }

  @Test
  public void badArgumentsAreRejected()
  {
    assertThrows(IllegalArgumentException.class,
                 () -> new Driver().run(new String[] { "input.f90" }, k.program));
    assertThrows(IllegalArgumentException.class,
                 () -> new Driver().run(new String[] { "-verbosity=4" }, k.program));
    assertThrows(IllegalArgumentException.class,
                 () -> new Driver().run(new String[] { "-verbosity=loud" }, k.program));
    assertThrows(IllegalArgumentException.class,
                 () -> new Driver().run(new String[] { "-ubound=" }, k.program));
  }

  @Test
  public void unknownOptionsAreIgnored()
  {
    Driver driver = new Driver();
    driver.parseCommandLine(new String[] { "-no-such-option", "-verbosity" });
    assertNull(driver.getOptionValue("no-such-option"));
    assertEquals("1", driver.getOptionValue("verbosity"));
    assertEquals(1, driver.buildConfig().getVerbosity());
  }
}
