package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a range {@code lb:ub} of an array dimension.
*/
public class RangeExpression extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = RangeExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a range expression.
    *
    * @param lb The lower bound.
    * @param ub The upper bound.
    * @throws NotAnOrphanException if a bound has a parent object.
    */
    public RangeExpression(Expression lb, Expression ub) {
        super(2);
        object_print_method = class_print_method;
        lb.setParens(false);
        ub.setParens(false);
        addChild(lb);
        addChild(ub);
    }

    @Override
    public RangeExpression clone() {
        return (RangeExpression)super.clone();
    }

    public static void defaultPrint(RangeExpression e, PrintWriter o) {
        e.getLB().print(o);
        o.print(":");
        e.getUB().print(o);
    }

    public Expression getLB() {
        return (Expression)children.get(0);
    }

    public Expression getUB() {
        return (Expression)children.get(1);
    }

}
