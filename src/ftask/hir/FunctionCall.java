package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* Represents a call to a function or intrinsic whose body is not analyzed,
* {@code f(i)} or {@code LBOUND(a, 1)}.
*/
public class FunctionCall extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = FunctionCall.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a function call.
    *
    * @param function The name of the called function.
    * @param args The actual arguments.
    * @throws NotAnOrphanException if <b>function</b> or an argument has a
    * parent object.
    */
    public FunctionCall(Expression function, List<? extends Expression> args) {
        super(args.size() + 1);
        object_print_method = class_print_method;
        addChild(function);
        for (Expression arg : args) {
            arg.setParens(false);
            addChild(arg);
        }
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    public static void defaultPrint(FunctionCall e, PrintWriter o) {
        e.getName().print(o);
        o.print("(");
        for (int i = 1; i < e.children.size(); i++) {
            if (i > 1) {
                o.print(",");
            }
            e.children.get(i).print(o);
        }
        o.print(")");
    }

    /** Returns the expression naming the called function. */
    public Expression getName() {
        return (Expression)children.get(0);
    }

    /** Returns the n-th argument. */
    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns the number of arguments. */
    public int getNumArguments() {
        return children.size() - 1;
    }

}
