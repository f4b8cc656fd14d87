package ftask.hir;

import static ftask.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import ftask.KernelFixtures;

public class DFIteratorTests {

    @Test
    public void visitsInSourceOrder() {
        KernelFixtures k = new KernelFixtures();
        VariableSymbol i = k.scalar("i");
        VariableSymbol j = k.scalar("j");
        DoLoop inner = loop(j, lit(1), lit(5));
        DoLoop outer = loop(i, lit(1), lit(10), inner);
        DoLoop last = loop(j, lit(1), lit(3));
        k.add(outer, last);

        List<DoLoop> loops = new DFIterator<DoLoop>(k.program, DoLoop.class).getList();
        assertEquals(3, loops.size());
        assertSame(outer, loops.get(0));
        assertSame(inner, loops.get(1));
        assertSame(last, loops.get(2));
    }

    @Test
    public void includesMatchingRoot() {
        KernelFixtures k = new KernelFixtures();
        VariableSymbol i = k.scalar("i");
        DoLoop outer = loop(i, lit(1), lit(10));
        DFIterator<DoLoop> iter = new DFIterator<DoLoop>(outer, DoLoop.class);
        assertTrue(iter.hasNext());
        assertSame(outer, iter.next());
        assertFalse(iter.hasNext());
        assertThrows(NoSuchElementException.class, iter::next);
    }

    @Test
    public void prunedSubtreesAreSkipped() {
        KernelFixtures k = new KernelFixtures();
        VariableSymbol i = k.scalar("i");
        VariableSymbol x = k.scalar("x");
        k.add(assign(id(x), lit(1)), loop(i, lit(1), lit(10), assign(id(x), id(i))));

        DFIterator<Identifier> iter =
                new DFIterator<Identifier>(k.program, Identifier.class);
        assertEquals(4, iter.getList().size());
        iter.pruneOn(DoLoop.class);
        assertEquals(1, iter.getList().size());
    }

    @Test
    public void resetRestartsAtRoot() {
        KernelFixtures k = new KernelFixtures();
        VariableSymbol x = k.scalar("x");
        k.add(assign(id(x), lit(1)));
        DFIterator<Statement> iter = new DFIterator<Statement>(k.program, Statement.class);
        Statement first = iter.next();
        while (iter.hasNext()) {
            iter.next();
        }
        iter.reset();
        assertSame(first, iter.next());
    }
}
