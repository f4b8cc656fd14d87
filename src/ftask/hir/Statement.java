package ftask.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
* Base class for all statements. Statements are compared by identity, so a
* statement is only equal to itself.
*/
public abstract class Statement implements Cloneable, Traversable {

    /** The print method for the statement */
    protected Method object_print_method;

    /** The parent traversable object */
    protected Traversable parent;

    /** The list of children of the statement */
    protected List<Traversable> children;

    /** Constructor for derived classes. */
    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Constructor for derived classes that preallocates
    * space for multiple children.
    *
    * @param size The expected number of children for this statement.
    */
    protected Statement(int size) {
        parent = null;
        children = new ArrayList<Traversable>(size);
    }

    /** Returns a deep copy of the statement without a parent. */
    @Override
    public Statement clone() {
        Statement o = null;
        try {
            o = (Statement)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.object_print_method = object_print_method;
        o.parent = null;
        o.children = new ArrayList<Traversable>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Traversable child = children.get(i);
            Traversable o_child = null;
            if (child instanceof Statement) {
                o_child = ((Statement)child).clone();
            } else if (child instanceof Expression) {
                o_child = ((Expression)child).clone();
            } else if (child != null) {
                throw new InternalError(
                        "Statement contains an unknown child type" + this);
            }
            if (o_child != null) {
                o_child.setParent(o);
            }
            o.children.add(o_child);
        }
        return o;
    }

    /**
    * Compares the statement with the specified object for equality.
    *
    * @param o the object to be compared.
    * @return true if {@code (o == this)}, false otherwise.
    */
    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    /**
    * Detaches this statement from it's parent, if it has one.
    */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
            setParent(null);
        }
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * Returns the routine in which this statement is located.
    *
    * @return the enclosing routine, or null if it is not in one.
    */
    public Routine getRoutine() {
        return IRTools.getAncestorOfType(this, Routine.class);
    }

    /**
    * Prints the statement on the specified print writer.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (object_print_method == null) {
            return;
        }
        try {
            object_print_method.invoke(null, new Object[] {this, o});
        } catch(IllegalAccessException e) {
            throw new InternalError(e.getMessage());
        } catch(InvocationTargetException e) {
            throw new InternalError(e.getCause().toString());
        }
    }

    /**
    * Removes a specific child of this statement;
    * some statements do not support this method.
    *
    * @param child The child to remove.
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
            "This statement does not support removal of arbitrary children.");
    }

    public void setChild(int index, Traversable t) {
        if (t == null || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /** Returns a string representation of the statement */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Inserts the specified traversable object at the end of the child list.
    *
    * @param t the traversable object to be inserted.
    * @throws IllegalArgumentException if <b>t</b> is null.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t == null) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    /**
    * Inserts the specified traversable object at the specified position.
    *
    * @throws IllegalArgumentException if <b>t</b> is null or index is
    * out-of-bound.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(int index, Traversable t) {
        if (t == null || index < 0 || index > children.size()) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(index, t);
        t.setParent(this);
    }

}
