package ftask.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
* Base class for all expressions. Expressions are compared structurally
* against other expressions when used in collections, so two separately built
* copies of {@code a(i+1)} are equal and hash alike.
*/
public abstract class Expression
                implements Cloneable, Comparable<Expression>, Traversable {

    /** The print method for the expression */
    protected Method object_print_method;

    /** The parent object of the expression */
    protected Traversable parent;

    /** All children must be Expressions. */
    protected List<Traversable> children;

    /**
    * Determines whether this expression should have a set of parentheses
    * around it when printed.
    */
    protected boolean needs_parens;

    /** Empty child list for expressions having no children */
    protected static final List<Traversable> empty_list =
            Collections.unmodifiableList(new ArrayList<Traversable>(0));

    /** Constructor for derived classes. */
    protected Expression() {
        parent = null;
        children = new ArrayList<Traversable>(1);
        needs_parens = true;
    }

    /**
    * Constructor for derived classes.
    *
    * @param size The initial size for the child list; a negative size marks
    *   a leaf expression that never has children.
    */
    protected Expression(int size) {
        parent = null;
        if (size < 0) {
            children = empty_list;
        } else {
            children = new ArrayList<Traversable>(size);
        }
        needs_parens = true;
    }

    /**
    * Creates and returns a deep copy of this expression. The copy has no
    * parent.
    *
    * @return a deep copy of this expression.
    */
    @Override
    public Expression clone() {
        Expression o = null;
        try {
            o = (Expression)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.object_print_method = object_print_method;
        o.parent = null;
        if (children != empty_list) {
            o.children = new ArrayList<Traversable>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Expression new_child = ((Expression)children.get(i)).clone();
                new_child.setParent(o);
                o.children.add(new_child);
            }
        }
        o.needs_parens = needs_parens;
        return o;
    }

    /* Comparable interface */
    public int compareTo(Expression e) {
        if (equals(e)) {
            return 0;
        } else {
            return toString().compareTo(e.toString());
        }
    }

    /**
    * Checks if the given object has the same type as this expression and
    * structurally equal children. Sub classes with additional fields call this
    * method first and then compare their own fields.
    *
    * @param o the object to be compared with.
    * @return true if {@code o} is an expression of the same class with equal
    *   children.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || this.getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    /**
    * Returns the hash code of the expression, consistent with the structural
    * {@link #equals}. Sub classes with additional fields mix them into the
    * value returned by this method.
    *
    * @return the integer hash code of the expression.
    */
    @Override
    public int hashCode() {
        int h = getClass().getName().hashCode();
        for (int i = 0; i < children.size(); i++) {
            h = 31 * h + children.get(i).hashCode();
        }
        return h;
    }

    /**
    * Returns a list of subexpressions of this expression that match
    * <var>expr</var> using its equals method, in source order.
    *
    * @param expr The subexpression sought.
    * @return a list of matching subexpressions, which may be empty.
    */
    public List<Expression> findExpression(Expression expr) {
        List<Expression> result = new LinkedList<Expression>();
        if (expr != null) {
            DFIterator<Expression> iter =
                    new DFIterator<Expression>(this, Expression.class);
            while (iter.hasNext()) {
                Expression e = iter.next();
                if (expr.equals(e)) {
                    result.add(e);
                }
            }
        }
        return result;
    }

    /* Traversable interface */
    public List<Traversable> getChildren() {
        return children;
    }

    /* Traversable interface */
    public Traversable getParent() {
        return parent;
    }

    /**
    * Get the parent Statement containing this Expression.
    *
    * @return the enclosing Statement or null if this Expression
    *   is not inside a Statement.
    */
    public Statement getStatement() {
        Traversable t = this;
        do {
            t = t.getParent();
        } while (t != null && !(t instanceof Statement));
        return (Statement)t;
    }

    /**
    * Prints the expression on the specified print writer.
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
    * This operation is not allowed.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Expressions do not support removal of arbitrary children.");
    }

    /**
    * @throws NotAnOrphanException if <b>t</b> has a parent object.
    * @throws IllegalArgumentException if <b>index</b> is out-of-range or
    * <b>t</b> is not an expression.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        if (!(t instanceof Expression) || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        // Detach the old child
        if (children.get(index) != null) {
            children.get(index).setParent(null);
        }
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * Sets whether the expression needs to have
    * an outer set of parentheses printed around it.
    *
    * @param f True to use parens, false to not use parens.
    */
    public void setParens(boolean f) {
        needs_parens = f;
    }

    /**
    * Checks if the expression needs parentheses around itself when printed.
    */
    public boolean needsParens() {
        return needs_parens;
    }

    /* Traversable interface */
    public void setParent(Traversable t) {
        // expressions can appear in many places so it's probably not
        // worth it to try and provide instanceof checks against t here
        parent = t;
    }

    /** Returns a string representation of the expression */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    /**
    * Common operation used in constructors - adds the specified traversable
    * object at the end of the child list.
    *
    * @param t the new child object to be added.
    * @throws NotAnOrphanException if <b>t</b> has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(this.getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

}
