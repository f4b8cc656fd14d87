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
import ftask.exec.TaskClauseConfig;
import ftask.hir.*;

public class DependClauseBuilderTests
{
  private final KernelFixtures k = new KernelFixtures();

  private ClauseSets compute(TaskRegion task) throws TaskClauseException
  {
    return compute(task, TaskClauseConfig.getDefault());
  }

  private ClauseSets compute(TaskRegion task, TaskClauseConfig config)
    throws TaskClauseException
  {
    return new DependClauseBuilder(new RegionSymbolResolver(), config).computeClauses(task);
  }

  private TaskClauseException reject(TaskRegion task)
  {
    return assertThrows(TaskClauseException.class, () -> compute(task));
  }

  private static List<String> set(ClauseSets sets, ClauseType type)
  {
    return render(sets.get(type));
  }

  private static List<String> list(String... items)
  {
    return Arrays.asList(items);
  }

  @Test
  public void recurrenceOnSharedArray() throws TaskClauseException
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol d = k.scalar("d");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10),
           assign(at(c, id(i)),
                  new BinaryExpression(at(c, minus(i, 1)), BinaryOperator.ADD, id(d))))),
      privates());

    ClauseSets sets = compute(task);
    assertEquals(list("i"), set(sets, ClauseType.PRIVATE));
    assertEquals(list(), set(sets, ClauseType.FIRSTPRIVATE));
    assertEquals(list("c", "d"), set(sets, ClauseType.SHARED));
    assertEquals(list("c(i-1)", "d"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("c(i)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void regionPrivateLoopVariableGivesFullRange() throws TaskClauseException
  {
    VariableSymbol b = k.array("b", 1);
    VariableSymbol j = k.scalar("j");
    TaskRegion task = k.placeTask(task(
      loop(j, lit(1), lit(10),
           assign(at(b, id(j)),
                  new BinaryExpression(at(b, id(j)), BinaryOperator.ADD, lit(1))))),
      privates(j));

    ClauseSets sets = compute(task);
    assertEquals(list("j"), set(sets, ClauseType.PRIVATE));
    assertEquals(list("b"), set(sets, ClauseType.SHARED));
    assertEquals(list("b(LBOUND(b,1):UBOUND(b,1))"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("b(LBOUND(b,1):UBOUND(b,1))"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void fullRangeOnlyInPrivateDimension() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 2);
    VariableSymbol i = k.scalar("i");
    VariableSymbol j = k.scalar("j");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10),
           loop(j, lit(1), lit(10), assign(at(a, id(i), id(j)), lit(0))))),
      privates(j));

    ClauseSets sets = compute(task);
    assertEquals(list("i", "j"), set(sets, ClauseType.PRIVATE));
    assertEquals(list("a(i, LBOUND(a,2):UBOUND(a,2))"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void boundNamesComeFromConfig() throws TaskClauseException
  {
    VariableSymbol b = k.array("b", 1);
    VariableSymbol j = k.scalar("j");
    TaskRegion task = k.placeTask(task(
      loop(j, lit(1), lit(10), assign(at(b, id(j)), lit(0)))),
      privates(j));

    TaskClauseConfig config = new TaskClauseConfig("!$", "lbound", "ubound", 0);
    assertEquals(list("b(lbound(b,1):ubound(b,1))"),
                 set(compute(task, config), ClauseType.DEPEND_OUT));
  }

  @Test
  public void writeBeforeReadMakesPrivate() throws TaskClauseException
  {
    VariableSymbol x = k.scalar("x");
    VariableSymbol y = k.scalar("y");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(id(x), lit(1)), assign(id(y), id(x)))),
      privates(x, y));

    ClauseSets sets = compute(task);
    assertEquals(list("i", "x", "y"), set(sets, ClauseType.PRIVATE));
    assertEquals(list(), set(sets, ClauseType.FIRSTPRIVATE));
    assertEquals(list(), set(sets, ClauseType.SHARED));
  }

  @Test
  public void readBeforeWriteMakesFirstprivate() throws TaskClauseException
  {
    VariableSymbol x = k.scalar("x");
    VariableSymbol y = k.scalar("y");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(id(y), id(x)), assign(id(x), lit(1)))),
      privates(x, y));

    ClauseSets sets = compute(task);
    assertEquals(list("i", "y"), set(sets, ClauseType.PRIVATE));
    assertEquals(list("x"), set(sets, ClauseType.FIRSTPRIVATE));
  }

  @Test
  public void sharedScalarsAndCallArguments() throws TaskClauseException
  {
    VariableSymbol x = k.scalar("x");
    VariableSymbol y = k.scalar("y");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(id(x), call("sqrt", id(y))))),
      privates());

    ClauseSets sets = compute(task);
    assertEquals(list("y", "x"), set(sets, ClauseType.SHARED));
    assertEquals(list("y"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("x"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void componentAccessDependsOnBase() throws TaskClauseException
  {
    VariableSymbol s = k.scalar("s");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10),
           assign(new AccessExpression(id(s), new NameID("f")), id(i)))),
      privates());

    ClauseSets sets = compute(task);
    assertEquals(list("s"), set(sets, ClauseType.DEPEND_OUT));
    assertEquals(list("s"), set(sets, ClauseType.SHARED));
  }

  @Test
  public void ifConditionIsRead() throws TaskClauseException
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol x = k.scalar("x");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10),
           new IfStatement(new BinaryExpression(id(x), BinaryOperator.COMPARE_GT, lit(0)),
                           block(assign(at(c, id(i)), id(x)))))),
      privates());

    ClauseSets sets = compute(task);
    assertEquals(list("x", "c"), set(sets, ClauseType.SHARED));
    assertEquals(list("x"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("c(i)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void literalAndPrivateScalarIndices() throws TaskClauseException
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol m = k.scalar("m");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(at(c, lit(1)), at(c, id(m))))),
      privates(m));

    ClauseSets sets = compute(task);
    assertEquals(list("m"), set(sets, ClauseType.FIRSTPRIVATE));
    assertEquals(list("c(m)"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("c(1)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void sharedIndexIsRejected()
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol m = k.scalar("m");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(at(c, id(m)), lit(0)))),
      privates());

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.SHARED_USED_AS_INDEX, e.getReason());
    assertEquals("m", e.getReference().toString());
  }

  @Test
  public void callInIndexIsRejected()
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol i = k.scalar("i");
    ExpressionStatement stmt = assign(at(c, call("f", id(i))), lit(0));
    TaskRegion task = k.placeTask(task(loop(i, lit(1), lit(10), stmt)), privates());

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM, e.getReason());
    assertSame(stmt, e.getStatement());
  }

  // do t = 1, 5
  //   do u = 1, 5
  //     task: do i = 1, 10; c(t, i) = 0
  private TaskRegion nestedTask(VariableSymbol c, VariableSymbol t, VariableSymbol u,
                                VariableSymbol i, List<Symbol> regionPrivates)
  {
    TaskRegion task = task(loop(i, lit(1), lit(10), assign(at(c, id(t), id(i)), lit(0))));
    k.placeInSingle(loop(t, lit(1), lit(5), loop(u, lit(1), lit(5), task)), regionPrivates);
    return task;
  }

  @Test
  public void enclosingLoopVariableBecomesFirstprivate() throws TaskClauseException
  {
    VariableSymbol c = k.array("c", 2);
    VariableSymbol t = k.scalar("t");
    VariableSymbol u = k.scalar("u");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = nestedTask(c, t, u, i, privates(t, u));

    ClauseSets sets = compute(task);
    assertEquals(list("i"), set(sets, ClauseType.PRIVATE));
    assertEquals(list("t"), set(sets, ClauseType.FIRSTPRIVATE));
    assertEquals(list("c(t, i)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void sharedEnclosingLoopVariableIsRejected()
  {
    VariableSymbol c = k.array("c", 2);
    VariableSymbol t = k.scalar("t");
    VariableSymbol u = k.scalar("u");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = nestedTask(c, t, u, i, privates(u));

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.SHARED_USED_AS_INDEX, e.getReason());
    assertEquals("t", e.getReference().toString());
  }

  @Test
  public void loopOutsideRegionIsNotAnInductionVariable()
  {
    VariableSymbol c = k.array("c", 2);
    VariableSymbol t = k.scalar("t");
    VariableSymbol i = k.scalar("i");
    TaskRegion task = task(loop(i, lit(1), lit(10), assign(at(c, id(t), id(i)), lit(0))));
    k.add(loop(t, lit(1), lit(5), parallel(privates(), single(task))));

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.SHARED_USED_AS_INDEX, e.getReason());
    assertEquals("t", e.getReference().toString());
  }

  @Test
  public void sharedParentVariableIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol j = k.scalar("j");
    TaskRegion task = task(loop(j, lit(1), lit(10), assign(at(a, id(i)), lit(0))));
    k.placeInSingle(loop(i, lit(1), lit(100), task), privates(j));

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.SHARED_USED_AS_INDEX, e.getReason());
    assertEquals("i", e.getReference().toString());
  }

  @Test
  public void sharedParentVariableOffsetIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol j = k.scalar("j");
    TaskRegion task = task(loop(j, lit(1), lit(10), assign(at(a, plus(i, 1)), lit(0))));
    k.placeInSingle(loop(i, lit(1), lit(100), lit(4), task), privates(j));

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.SHARED_USED_AS_INDEX, e.getReason());
    assertEquals("i+1", e.getReference().toString());
  }

  // do i = 1, 100, step
  //   task: do ii = i, i+3; a(ii) = rhs
  private TaskRegion chunkedTask(VariableSymbol a, VariableSymbol i, VariableSymbol ii,
                                 Expression step, Expression rhs)
  {
    TaskRegion task = task(
      loop(ii, id(i), plus(i, 3), assign(at(a, id(ii)), rhs)));
    k.placeInSingle(loop(i, lit(1), lit(100), step, task), privates(i));
    return task;
  }

  @Test
  public void offsetWithinOneChunkGivesTwoTerms() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4), at(a, plus(i, 1)));

    ClauseSets sets = compute(task);
    assertEquals(list("ii"), set(sets, ClauseType.PRIVATE));
    assertEquals(list("i"), set(sets, ClauseType.FIRSTPRIVATE));
    assertEquals(list("a"), set(sets, ClauseType.SHARED));
    assertEquals(list("a(i+4)", "a(i)"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("a(i)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void negativeLiteralFirstOffset() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4),
      at(a, new BinaryExpression(lit(-1), BinaryOperator.ADD, id(i))));

    assertEquals(list("a(i-4)", "a(i)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void negativeLiteralFirstProxyOffset() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4),
      at(a, new BinaryExpression(lit(-5), BinaryOperator.ADD, id(ii))));

    assertEquals(list("a(i-8)", "a(i-4)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void positiveLiteralFirstOffsetKeepsOrder() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4),
      at(a, new BinaryExpression(lit(5), BinaryOperator.ADD, id(i))));

    assertEquals(list("a(8+i)", "a(4+i)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void oversizedOffsetIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4), at(a, plus(i, Long.MAX_VALUE)));

    assertSame(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM, reject(task).getReason());
  }

  @Test
  public void minimumLongStepIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(Long.MIN_VALUE), at(a, plus(i, 1)));

    assertSame(TaskClauseException.Reason.UNSUPPORTED_INDEX_FORM, reject(task).getReason());
  }

  @Test
  public void offsetOfWholeStepGivesOneTerm() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4), at(a, minus(i, 4)));

    assertEquals(list("a(i-4)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void offsetBeyondOneStep() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4), at(a, plus(i, 5)));

    assertEquals(list("a(i+8)", "a(i+4)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void proxyOffsetUsesParentVariable() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4),
      at(a, new BinaryExpression(lit(1), BinaryOperator.ADD, id(ii))));

    assertEquals(list("a(4+i)", "a(i)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void negativeStepUsesMagnitude() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii,
                                  new UnaryExpression(UnaryOperator.MINUS, lit(4)),
                                  at(a, minus(i, 1)));

    assertEquals(list("a(i-4)", "a(i)"), set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void everyDimensionCombinationIsListed() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol b = k.array("b", 2);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(4), at(b, plus(i, 1), plus(ii, 1)));

    assertEquals(list("b(i+4, i+4)", "b(i+4, i)", "b(i, i+4)", "b(i, i)"),
                 set(compute(task), ClauseType.DEPEND_IN));
  }

  @Test
  public void nonLiteralStepIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    VariableSymbol s = k.scalar("s");
    TaskRegion task = chunkedTask(a, i, ii, id(s), at(a, plus(i, 1)));

    assertSame(TaskClauseException.Reason.NON_LITERAL_STEP_UNSUPPORTED,
               reject(task).getReason());
  }

  @Test
  public void zeroStepIsRejected()
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    TaskRegion task = chunkedTask(a, i, ii, lit(0), at(a, plus(i, 1)));

    assertSame(TaskClauseException.Reason.NON_LITERAL_STEP_UNSUPPORTED,
               reject(task).getReason());
  }

  @Test
  public void bareParentVariableNeedsNoStep() throws TaskClauseException
  {
    VariableSymbol a = k.array("a", 1);
    VariableSymbol i = k.scalar("i");
    VariableSymbol ii = k.scalar("ii");
    VariableSymbol s = k.scalar("s");
    TaskRegion task = chunkedTask(a, i, ii, id(s), at(a, id(i)));

    ClauseSets sets = compute(task);
    assertEquals(list("a(i)"), set(sets, ClauseType.DEPEND_IN));
    assertEquals(list("a(i)"), set(sets, ClauseType.DEPEND_OUT));
  }

  @Test
  public void taskOutsideParallelRegionIsRejected()
  {
    VariableSymbol i = k.scalar("i");
    TaskRegion task = task(loop(i, lit(1), lit(10)));
    k.add(single(task));

    TaskClauseException e = reject(task);
    assertSame(TaskClauseException.Reason.MISSING_ENCLOSING_REGION, e.getReason());
    assertSame(task, e.getStatement());
  }

  @Test
  public void bodyMustBeOneLoop()
  {
    VariableSymbol i = k.scalar("i");
    VariableSymbol x = k.scalar("x");
    TaskRegion twoLoops = k.placeTask(task(loop(i, lit(1), lit(2)), loop(i, lit(1), lit(2))),
                                      privates());
    assertSame(TaskClauseException.Reason.MALFORMED_TASK_BODY, reject(twoLoops).getReason());

    TaskRegion noLoop = k.placeTask(task(assign(id(x), lit(1))), privates());
    assertSame(TaskClauseException.Reason.MALFORMED_TASK_BODY, reject(noLoop).getReason());

    TaskRegion empty = k.placeTask(task(), privates());
    assertSame(TaskClauseException.Reason.MALFORMED_TASK_BODY, reject(empty).getReason());
  }

  @Test
  public void unsupportedStatementsAreRejected()
  {
    VariableSymbol i = k.scalar("i");
    TaskRegion nested = k.placeTask(task(loop(i, lit(1), lit(2), single())), privates());
    assertSame(TaskClauseException.Reason.MALFORMED_TASK_BODY, reject(nested).getReason());

    TaskRegion badTarget = k.placeTask(task(loop(i, lit(1), lit(2), assign(lit(1), lit(2)))),
                                       privates());
    assertSame(TaskClauseException.Reason.MALFORMED_TASK_BODY, reject(badTarget).getReason());
  }

  @Test
  public void computationIsDeterministicAndLeavesTaskAlone() throws TaskClauseException
  {
    VariableSymbol c = k.array("c", 1);
    VariableSymbol i = k.scalar("i");
    TaskRegion task = k.placeTask(task(
      loop(i, lit(1), lit(10), assign(at(c, id(i)), at(c, plus(i, 1))))),
      privates());

    ClauseSets first = compute(task);
    assertEquals(first, compute(task));
    assertEquals(first.hashCode(), compute(task).hashCode());
    assertEquals("omp task", task.getDirectiveText());
  }
}
