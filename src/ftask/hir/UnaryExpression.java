package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an expression with a prefix operator, {@code -x} or
* {@code .not. flag}.
*/
public class UnaryExpression extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = UnaryExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    protected UnaryOperator op;

    /**
    * Creates a unary expression.
    *
    * @param op The unary operator.
    * @param expr The operand expression.
    * @throws NotAnOrphanException if <b>expr</b> has a parent object.
    */
    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        object_print_method = class_print_method;
        this.op = op;
        addChild(expr);
    }

    @Override
    public UnaryExpression clone() {
        UnaryExpression o = (UnaryExpression)super.clone();
        o.op = op;
        return o;
    }

    public static void defaultPrint(UnaryExpression e, PrintWriter o) {
        if (e.needs_parens) {
            o.print("(");
        }
        e.op.print(o);
        e.getExpression().print(o);
        if (e.needs_parens) {
            o.print(")");
        }
    }

    /** Returns the operand of the expression. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /** Returns the operator of the expression. */
    public UnaryOperator getOperator() {
        return op;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + op.value;
    }

}
