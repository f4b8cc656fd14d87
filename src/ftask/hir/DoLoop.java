package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a counted loop {@code do var = start, stop, step}. The children
* are, in order, the induction variable, the start, stop and step
* expressions and the body.
*/
public class DoLoop extends Statement implements Loop {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = DoLoop.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a loop with a step of 1.
    *
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public DoLoop(Identifier var, Expression start, Expression stop,
            CompoundStatement body) {
        this(var, start, stop, new IntegerLiteral(1), body);
    }

    /**
    * Creates a loop.
    *
    * @param var the induction variable.
    * @param start the initial value.
    * @param stop the final value.
    * @param step the increment.
    * @param body the iterated statements.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public DoLoop(Identifier var, Expression start, Expression stop,
            Expression step, CompoundStatement body) {
        super(5);
        object_print_method = class_print_method;
        start.setParens(false);
        stop.setParens(false);
        step.setParens(false);
        addChild(var);
        addChild(start);
        addChild(stop);
        addChild(step);
        addChild(body);
    }

    @Override
    public DoLoop clone() {
        return (DoLoop)super.clone();
    }

    /**
    * Prints the loop header, the indented body and {@code end do}. A step of
    * 1 is omitted from the header.
    */
    public static void defaultPrint(DoLoop loop, PrintWriter o) {
        o.print("do ");
        loop.getIndexVariable().print(o);
        o.print(" = ");
        loop.getStart().print(o);
        o.print(", ");
        loop.getStop().print(o);
        Expression step = loop.getStep();
        if (!(step instanceof IntegerLiteral) ||
            ((IntegerLiteral)step).getValue() != 1) {
            o.print(", ");
            step.print(o);
        }
        o.print("\n");
        String body = loop.getBody().toString();
        if (body.length() > 0) {
            o.print(Tools.indent(body, "  "));
            o.print("\n");
        }
        o.print("end do");
    }

    public Identifier getIndexVariable() {
        return (Identifier)children.get(0);
    }

    public Expression getStart() {
        return (Expression)children.get(1);
    }

    public Expression getStop() {
        return (Expression)children.get(2);
    }

    public Expression getStep() {
        return (Expression)children.get(3);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(4);
    }

}
