package ftask.hir;

import ftask.analysis.TaskClauseException;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class of the OpenMP directive regions. A region owns a single body
* block as its only child and a list of clauses. The clauses are not part of
* the child list, so walking a region visits the body only; the clause list
* is replaced as a whole through {@link #replaceClauses}.
*/
public abstract class DirectiveRegion extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = DirectiveRegion.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** Default directive sentinel for free-form Fortran. */
    public static final String DEFAULT_SENTINEL = "!$";

    /** The current clauses, never modified in place. */
    private List<Clause> clauses;

    private String sentinel;

    /**
    * Creates a region around the given body.
    *
    * @param body the statements of the region.
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    protected DirectiveRegion(CompoundStatement body) {
        super(1);
        object_print_method = class_print_method;
        addChild(body);
        clauses = Collections.emptyList();
        sentinel = DEFAULT_SENTINEL;
    }

    /** Returns a deep copy of the region including its clauses. */
    @Override
    public DirectiveRegion clone() {
        DirectiveRegion o = (DirectiveRegion)super.clone();
        List<Clause> copy = new ArrayList<Clause>(clauses.size());
        for (Clause c : clauses) {
            List<Expression> items = new ArrayList<Expression>();
            for (Expression e : c.getItems()) {
                items.add(e.clone());
            }
            copy.add(new Clause(c.getType(), items));
        }
        o.clauses = Collections.emptyList();
        o.replaceClauses(copy);
        return o;
    }

    /**
    * Prints the begin directive, the body and the end directive. The
    * clauses printed are the ones currently attached.
    */
    public static void defaultPrint(DirectiveRegion stmt, PrintWriter o) {
        o.print(stmt.sentinel);
        o.print(stmt.getDirectiveText());
        o.print("\n");
        String body = stmt.getBody().toString();
        if (body.length() > 0) {
            o.print(body);
            o.print("\n");
        }
        o.print(stmt.sentinel);
        o.print(stmt.endString());
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    /** Returns the attached clauses in slot order. */
    public List<Clause> getClauses() {
        return clauses;
    }

    public String getSentinel() {
        return sentinel;
    }

    public void setSentinel(String sentinel) {
        this.sentinel = sentinel;
    }

    /**
    * Returns the begin directive built from the currently attached clauses,
    * without the sentinel, {@code omp parallel default(shared)}.
    */
    public abstract String getDirectiveText();

    /** Returns the end directive without the sentinel. */
    public abstract String endString();

    /**
    * Checks the placement of the region among the other directive regions.
    *
    * @throws TaskClauseException with reason INVALID_NESTING if the region
    * is not nested correctly.
    */
    public abstract void validateGlobalConstraints()
            throws TaskClauseException;

    /**
    * Swaps in a new clause list in one step. The old clauses are detached,
    * the new ones are adopted; nothing else observes an intermediate state.
    *
    * @param new_clauses the complete new clause list.
    * @throws NotAnOrphanException if a new clause already has a parent.
    */
    protected void replaceClauses(List<Clause> new_clauses) {
        for (Clause c : new_clauses) {
            if (c.getParent() != null && !containsClause(c)) {
                throw new NotAnOrphanException(getClass().getName());
            }
        }
        List<Clause> adopted = Collections.unmodifiableList(
                new ArrayList<Clause>(new_clauses));
        for (Clause c : clauses) {
            c.setParent(null);
        }
        for (Clause c : adopted) {
            c.setParent(this);
        }
        clauses = adopted;
    }

    /** Renders the non-empty clauses separated by blanks. */
    protected String clausesToString() {
        StringBuilder sb = new StringBuilder(80);
        for (Clause c : clauses) {
            if (!c.isEmpty()) {
                sb.append(" ").append(c);
            }
        }
        return sb.toString();
    }

    private boolean containsClause(Clause c) {
        return Tools.identityIndexOf(clauses, c) >= 0;
    }

    /**
    * The body of a region can be replaced but not removed.
    * @throws UnsupportedOperationException always
    */
    @Override
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Directive regions do not support removal of the body.");
    }

}
