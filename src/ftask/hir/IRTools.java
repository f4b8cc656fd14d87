package ftask.hir;

import java.util.List;

/**
* <b>IRTools</b> provides tree queries shared by the analyses and passes.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Checks the parent/child links under {@code t}: every descendant must
    * have a parent that lists it as a child.
    *
    * @param t the traversable object to be checked.
    * @return true if it is consistent, false otherwise.
    */
    public static boolean checkConsistency(Traversable t) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null ||
                Tools.identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the closest ancestor of {@code t} with the given type.
    *
    * @param t the traversable object where the search starts.
    * @param type the IR type being searched for.
    * @return the youngest ancestor of {@code t} having the type, or null.
    */
    @SuppressWarnings("unchecked")
    public static <T extends Traversable> T
            getAncestorOfType(Traversable t, Class<T> type) {
        if (t == null) {
            return null;
        }
        Traversable ret = t.getParent();
        while (ret != null && !type.isInstance(ret)) {
            ret = ret.getParent();
        }
        return (T)ret;
    }

    /**
    * Returns the descendants of {@code t} with the given type in source
    * order, excluding {@code t} itself.
    */
    public static <T extends Traversable> List<T>
            getDescendentsOfType(Traversable t, Class<T> type) {
        List<T> ret = (new DFIterator<T>(t, type)).getList();
        if (type.isInstance(t)) {
            ret.remove(0);
        }
        return ret;
    }

    /**
    * Checks if {@code anc} is a proper ancestor of {@code des}.
    */
    public static boolean isAncestorOf(Traversable anc, Traversable des) {
        if (anc == null || des == null || anc == des) {
            return false;
        }
        Traversable t = des.getParent();
        while (t != null && t != anc) {
            t = t.getParent();
        }
        return t == anc;
    }

}
