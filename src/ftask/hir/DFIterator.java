package ftask.hir;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Depth-first iterator over the IR tree that returns only the nodes of a
* requested type, in source order. The iterator keeps no work list; it finds
* the next node by walking the tree from the current one, so it stays valid
* and restartable through {@link #reset()} as long as the visited subtree is
* not modified.
*/
public class DFIterator<E extends Traversable> {

    /** List of types whose child nodes are skipped during iteration. */
    private List<Class<? extends Traversable>> pruned_on;

    /** The initial IR node of the iterator. */
    private Traversable root;

    /** The next IR node to be returned. */
    private Traversable next;

    /** The IR node type to be returned during iteration. */
    private Class<? extends Traversable> type;

    /**
    * Constructs a new iterator that returns every traversable node.
    *
    * @param root the initial node for the iteration.
    */
    public DFIterator(Traversable root) {
        this(root, Traversable.class);
    }

    /**
    * Constructs a new iterator that returns the specified IR type.
    *
    * @param root the initial node for the iteration.
    * @param c the IR class type to be iterated over.
    */
    public DFIterator(Traversable root, Class<? extends Traversable> c) {
        this.root = root;
        pruned_on = new ArrayList<Class<? extends Traversable>>(2);
        type = c;
        reset();
    }

    /**
    * Checks if there is a next element of the requested type.
    */
    public boolean hasNext() {
        return next != null;
    }

    /**
    * Returns the next IR node.
    *
    * @return the next IR node.
    * @throws NoSuchElementException if no more elements are found.
    */
    @SuppressWarnings("unchecked")
    public E next() {
        if (next == null) {
            throw new NoSuchElementException();
        }
        E ret = (E)next;
        next = findNext(ret);
        return ret;
    }

    /**
    * Skips the descendants of any node of the given type. The node itself is
    * still returned if it matches the requested type.
    *
    * @param c the IR node type to be pruned on.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        pruned_on.add(c);
        reset();
    }

    /** Restarts the iteration at the root node. */
    public void reset() {
        if (type.isInstance(root)) {
            next = root;
        } else {
            next = findNext(root);
        }
    }

    /**
    * Returns the remaining traversal of the tree as a list, starting over
    * from the root.
    *
    * @return the collected list.
    */
    public List<E> getList() {
        List<E> ret = new ArrayList<E>();
        reset();
        while (hasNext()) {
            ret.add(next());
        }
        return ret;
    }

    // Searches the subtree of t first, then climbs toward the root and
    // searches the unvisited right siblings on the way up.
    private Traversable findNext(Traversable t) {
        Traversable ret = searchBelow(t, 0);
        Traversable child = t;
        while (ret == null && child != root) {
            Traversable parent = child.getParent();
            if (parent == null) {
                break;
            }
            int pos = Tools.identityIndexOf(parent.getChildren(), child);
            ret = searchBelow(parent, pos + 1);
            child = parent;
        }
        return ret;
    }

    private Traversable searchBelow(Traversable t, int pos) {
        if (isPruned(t)) {
            return null;
        }
        List<Traversable> children = t.getChildren();
        if (children == null) {
            return null;
        }
        for (int i = pos; i < children.size(); i++) {
            Traversable child = children.get(i);
            if (child == null) {
                continue;
            }
            if (type.isInstance(child)) {
                return child;
            }
            Traversable ret = searchBelow(child, 0);
            if (ret != null) {
                return ret;
            }
        }
        return null;
    }

    private boolean isPruned(Traversable t) {
        for (Class<? extends Traversable> c : pruned_on) {
            if (c.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

}
