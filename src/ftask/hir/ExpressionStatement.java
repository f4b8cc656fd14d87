package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* A statement made of a single expression, normally an assignment.
*/
public class ExpressionStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = ExpressionStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a statement from an expression.
    *
    * @param expr The expression, usually an {@link AssignmentExpression}.
    * @throws NotAnOrphanException if <b>expr</b> has a parent.
    */
    public ExpressionStatement(Expression expr) {
        super(1);
        object_print_method = class_print_method;
        addChild(expr);
    }

    @Override
    public ExpressionStatement clone() {
        return (ExpressionStatement)super.clone();
    }

    public static void defaultPrint(ExpressionStatement stmt, PrintWriter o) {
        stmt.getExpression().print(o);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

}
