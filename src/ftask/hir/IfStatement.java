package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a block {@code if (cond) then ... else ... end if}. The else
* part is optional.
*/
public class IfStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = IfStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates an if statement without an else part.
    *
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, CompoundStatement true_clause) {
        super(2);
        object_print_method = class_print_method;
        condition.setParens(false);
        addChild(condition);
        addChild(true_clause);
    }

    /**
    * Creates an if statement with an else part.
    *
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public IfStatement(Expression condition, CompoundStatement true_clause,
            CompoundStatement false_clause) {
        this(condition, true_clause);
        addChild(false_clause);
    }

    @Override
    public IfStatement clone() {
        return (IfStatement)super.clone();
    }

    public static void defaultPrint(IfStatement stmt, PrintWriter o) {
        o.print("if (");
        stmt.getControlExpression().print(o);
        o.print(") then\n");
        printBlock(stmt.getThenStatement(), o);
        if (stmt.getElseStatement() != null) {
            o.print("else\n");
            printBlock(stmt.getElseStatement(), o);
        }
        o.print("end if");
    }

    private static void printBlock(CompoundStatement block, PrintWriter o) {
        String s = block.toString();
        if (s.length() > 0) {
            o.print(Tools.indent(s, "  "));
            o.print("\n");
        }
    }

    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getThenStatement() {
        return (CompoundStatement)children.get(1);
    }

    /** Returns the else part, or null if there is none. */
    public CompoundStatement getElseStatement() {
        if (children.size() < 3) {
            return null;
        }
        return (CompoundStatement)children.get(2);
    }

}
