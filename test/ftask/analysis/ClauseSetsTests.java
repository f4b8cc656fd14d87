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

import static ftask.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.Test;

import ftask.KernelFixtures;
import ftask.hir.*;

public class ClauseSetsTests
{
  private final KernelFixtures k = new KernelFixtures();
  private final VariableSymbol c = k.array("c", 1);
  private final VariableSymbol i = k.scalar("i");
  private final VariableSymbol x = k.scalar("x");

  @Test
  public void keepsFirstInsertionOrderWithoutDuplicates()
  {
    ClauseSets sets = new ClauseSets();
    assertTrue(sets.add(ClauseType.DEPEND_IN, at(c, minus(i, 1))));
    assertTrue(sets.add(ClauseType.DEPEND_IN, at(c, id(i))));
    assertFalse(sets.add(ClauseType.DEPEND_IN, at(c, minus(i, 1))));
    assertEquals(Arrays.asList("c(i-1)", "c(i)"), render(sets.get(ClauseType.DEPEND_IN)));
  }

  @Test
  public void taskLocalMeansPrivateOrFirstprivate()
  {
    ClauseSets sets = new ClauseSets();
    assertFalse(sets.isTaskLocal(x));
    sets.addSymbol(ClauseType.SHARED, x);
    assertFalse(sets.isTaskLocal(x));
    sets.addSymbol(ClauseType.FIRSTPRIVATE, x);
    assertTrue(sets.isTaskLocal(x));
    assertTrue(sets.contains(ClauseType.FIRSTPRIVATE, x));
    assertFalse(sets.contains(ClauseType.PRIVATE, x));
  }

  @Test
  public void clausesAreCopiesInSlotOrder()
  {
    ClauseSets sets = new ClauseSets();
    sets.addSymbol(ClauseType.PRIVATE, i);
    sets.add(ClauseType.DEPEND_OUT, at(c, id(i)));

    List<Clause> clauses = sets.toClauses();
    assertEquals(TaskRegion.NUM_CLAUSES, clauses.size());
    for (int n = 0; n < clauses.size(); n++)
      assertSame(ClauseType.values()[n], clauses.get(n).getType());
    assertEquals("depend(out: c(i))", clauses.get(4).toString());
    assertNotSame(sets.get(ClauseType.DEPEND_OUT).get(0), clauses.get(4).getItems().get(0));
    assertEquals(clauses, sets.toClauses());
    assertEquals("private={i} firstprivate={} shared={} depend_in={} depend_out={c(i)}",
                 sets.toString());
  }
}
