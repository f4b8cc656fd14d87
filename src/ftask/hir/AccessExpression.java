package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents the access of a structure component, {@code s%f} or
* {@code s(i)%f}. The left-hand side is the base reference and the
* right-hand side is the member name.
*/
public class AccessExpression extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = AccessExpression.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a component access.
    *
    * @param base The structure reference, an identifier or an array access.
    * @param member The member name.
    * @throws NotAnOrphanException if an argument has a parent object.
    */
    public AccessExpression(Expression base, Expression member) {
        super(2);
        object_print_method = class_print_method;
        addChild(base);
        addChild(member);
    }

    @Override
    public AccessExpression clone() {
        return (AccessExpression)super.clone();
    }

    public static void defaultPrint(AccessExpression e, PrintWriter o) {
        e.getBase().print(o);
        o.print("%");
        e.getMember().print(o);
    }

    /** Returns the structure reference. */
    public Expression getBase() {
        return (Expression)children.get(0);
    }

    /** Returns the member being accessed. */
    public Expression getMember() {
        return (Expression)children.get(1);
    }

    /**
    * Returns the innermost structure reference of a chain of component
    * accesses, {@code s(i)} for {@code s(i)%f%g}.
    */
    public Expression getRootBase() {
        Expression base = getBase();
        while (base instanceof AccessExpression) {
            base = ((AccessExpression)base).getBase();
        }
        return base;
    }

}
