package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* <b>AssignmentExpression</b> represents {@code lhs = rhs}. The left-hand
* side is a scalar, an array element or a structure component.
*/
public class AssignmentExpression extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = AssignmentExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an assignment expression.
    *
    * @param lhs The lefthand expression.
    * @param rhs The righthand expression.
    * @throws NotAnOrphanException if <b>lhs</b> or <b>rhs</b> has a parent
    * object.
    */
    public AssignmentExpression(Expression lhs, Expression rhs) {
        super(2);
        object_print_method = class_print_method;
        lhs.setParens(false);
        rhs.setParens(false);
        addChild(lhs);
        addChild(rhs);
        needs_parens = false;
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    /**
    * Prints an assignment expression to a stream.
    *
    * @param e The expression to print.
    * @param o The writer on which to print the expression.
    */
    public static void defaultPrint(AssignmentExpression e, PrintWriter o) {
        e.getLHS().print(o);
        o.print(" = ");
        e.getRHS().print(o);
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

}
