package ftask.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* A directive clause such as {@code private(i, j)} or
* {@code depend(in: a(i-1), b)}. The entries are the children of the clause;
* they are references for data-sharing clauses and array access terms for
* dependency clauses. Two clauses are equal when they have the same type and
* structurally equal entries in the same order.
*/
public class Clause implements Traversable {

    private final ClauseType type;

    private Traversable parent;

    private List<Traversable> children;

    /**
    * Creates an empty clause.
    *
    * @param type the clause type.
    */
    public Clause(ClauseType type) {
        this(type, Collections.<Expression>emptyList());
    }

    /**
    * Creates a clause with the given entries.
    *
    * @param type the clause type.
    * @param items the entries; each must not have a parent.
    * @throws NotAnOrphanException if an entry has a parent.
    */
    public Clause(ClauseType type, List<? extends Expression> items) {
        this.type = type;
        parent = null;
        children = new ArrayList<Traversable>(items.size());
        for (Expression item : items) {
            if (item.getParent() != null) {
                throw new NotAnOrphanException(getClass().getName());
            }
            item.setParens(false);
            children.add(item);
            item.setParent(this);
        }
    }

    public ClauseType getType() {
        return type;
    }

    /** Returns the entries of the clause in order. */
    @SuppressWarnings("unchecked")
    public List<Expression> getItems() {
        return Collections.unmodifiableList(
                (List<Expression>)(List<?>)children);
    }

    /** Checks if the clause has no entries. */
    public boolean isEmpty() {
        return children.isEmpty();
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Clauses are rebuilt as a whole rather than edited.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Clauses do not support removal of entries.");
    }

    /**
    * @throws UnsupportedOperationException always
    */
    public void setChild(int index, Traversable t) {
        throw new UnsupportedOperationException(
                "Clauses do not support replacement of entries.");
    }

    /**
    * Prints the clause, {@code keyword(entries)} or
    * {@code depend(modifier: entries)}.
    */
    public void print(PrintWriter o) {
        o.print(type.getKeyword());
        o.print("(");
        if (type.isDependency()) {
            o.print(type.getModifier());
            o.print(": ");
        }
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                o.print(", ");
            }
            children.get(i).print(o);
        }
        o.print(")");
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Clause)) {
            return false;
        }
        Clause other = (Clause)o;
        return type == other.type && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + children.hashCode();
    }

}
