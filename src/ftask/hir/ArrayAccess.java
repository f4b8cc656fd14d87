package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* Represents the access of an array variable, {@code a(i, j+1)}. Child 0 is
* the array name and the remaining children are the indices, one per
* dimension, in declaration order.
*/
public class ArrayAccess extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ArrayAccess.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an array access with a single index expression.
    *
    * @param array The array name.
    * @param index The expression with which to index the array.
    * @throws NotAnOrphanException if <b>array</b> or <b>index</b> has a parent
    * object.
    */
    public ArrayAccess(Expression array, Expression index) {
        super(2);
        object_print_method = class_print_method;
        addChild(array);
        addIndex(index);
    }

    /**
    * Creates an array access with multiple index expressions.
    *
    * @param array The array name.
    * @param indices A list of expressions with which to index the array.
    * @throws NotAnOrphanException if <b>array</b> or an element of
    * <b>indices</b> has a parent object.
    */
    public ArrayAccess(Expression array, List<? extends Expression> indices) {
        super(indices.size() + 1);
        object_print_method = class_print_method;
        addChild(array);
        for (Expression index : indices) {
            addIndex(index);
        }
    }

    /**
    * Appends an index, increasing the dimension of the array access.
    *
    * @param expr the new index expression to be inserted.
    * @throws NotAnOrphanException if <b>expr</b> has a parent object.
    */
    public void addIndex(Expression expr) {
        expr.setParens(false);
        addChild(expr);
    }

    @Override
    public ArrayAccess clone() {
        return (ArrayAccess)super.clone();
    }

    /**
    * Prints an array access expression to a stream.
    *
    * @param e The array access to print.
    * @param o The writer on which to print the array access.
    */
    public static void defaultPrint(ArrayAccess e, PrintWriter o) {
        e.getArrayName().print(o);
        o.print("(");
        for (int i = 0; i < e.getNumIndices(); i++) {
            if (i > 0) {
                o.print(", ");
            }
            e.getIndex(i).print(o);
        }
        o.print(")");
    }

    /**
    * Returns the expression being indexed, normally an {@link Identifier}.
    */
    public Expression getArrayName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the index expression of the given dimension (0-based).
    *
    * @param n the zero-based dimension.
    * @return the index of that dimension.
    */
    public Expression getIndex(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns the index expressions in dimension order. */
    @SuppressWarnings("unchecked")
    public List<Expression> getIndices() {
        return (List<Expression>)(List<?>)children.subList(1, children.size());
    }

    /** Returns the number of indices, which is the rank of the access. */
    public int getNumIndices() {
        return children.size() - 1;
    }

    /**
    * Replaces the index of the given dimension.
    *
    * @throws NotAnOrphanException if <b>expr</b> has a parent object.
    */
    public void setIndex(int n, Expression expr) {
        expr.setParens(false);
        setChild(n + 1, expr);
    }

}
