package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* <b>CompoundStatement</b> represents a sequence of statements, printed one
* per line.
*/
public class CompoundStatement extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = CompoundStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** Creates an empty compound statement. */
    public CompoundStatement() {
        object_print_method = class_print_method;
    }

    /**
    * Appends a statement.
    *
    * @param stmt The statement to add.
    * @throws NotAnOrphanException if <b>stmt</b> has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Inserts a statement before the reference statement.
    *
    * @throws NotAChildException if <b>ref_stmt</b> is not a child.
    * @throws NotAnOrphanException if <b>new_stmt</b> has a parent.
    */
    public void addStatementBefore(Statement ref_stmt, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref_stmt);
        if (index == -1) {
            throw new NotAChildException();
        }
        addChild(index, new_stmt);
    }

    @Override
    public CompoundStatement clone() {
        return (CompoundStatement)super.clone();
    }

    /**
    * Prints the statements of the block, one per line.
    *
    * @param stmt The block to print.
    * @param o The writer on which to print the block.
    */
    public static void defaultPrint(CompoundStatement stmt, PrintWriter o) {
        for (int i = 0; i < stmt.children.size(); i++) {
            if (i > 0) {
                o.print("\n");
            }
            stmt.children.get(i).print(o);
        }
    }

    /** Returns the statements of the block. */
    @SuppressWarnings("unchecked")
    public List<Statement> getStatements() {
        return (List<Statement>)(List<?>)children;
    }

    /** Returns the number of statements in the block. */
    public int countStatements() {
        return children.size();
    }

    @Override
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        child.setParent(null);
        children.remove(index);
    }

}
