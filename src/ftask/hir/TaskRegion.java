package ftask.hir;

import ftask.analysis.TaskClauseException;
import ftask.exec.TaskClauseConfig;
import ftask.transforms.TaskClauseMaterializer;

import java.util.ArrayList;
import java.util.List;

/**
* An {@code omp task} region. The region always carries exactly five
* clauses, in the order private, firstprivate, shared, depend(in) and
* depend(out). The clauses are derived from the body; they are recomputed
* and replaced as a whole whenever the directive text is requested through
* {@link #beginString(TaskClauseConfig)}.
*/
public class TaskRegion extends DirectiveRegion {

    /** Number of clause slots of a task region. */
    public static final int NUM_CLAUSES = 5;

    private static final ClauseType[] slot_types = ClauseType.values();

    /**
    * Creates a task region with five empty clauses.
    *
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public TaskRegion(CompoundStatement body) {
        super(body);
        List<Clause> empty = new ArrayList<Clause>(NUM_CLAUSES);
        for (ClauseType type : slot_types) {
            empty.add(new Clause(type));
        }
        replaceClauses(empty);
    }

    @Override
    public TaskRegion clone() {
        return (TaskRegion)super.clone();
    }

    /**
    * Returns the clause in the slot of the given type.
    *
    * @param type the clause type.
    * @return the attached clause of that type.
    */
    public Clause getClause(ClauseType type) {
        return getClauses().get(type.ordinal());
    }

    /**
    * Replaces all five clauses at once.
    *
    * @param new_clauses the clauses in slot order.
    * @throws InternalError if the list does not hold exactly one clause per
    * slot in slot order.
    */
    public void setClauses(List<Clause> new_clauses) {
        if (new_clauses.size() != NUM_CLAUSES) {
            throw new InternalError("task region expects " + NUM_CLAUSES +
                    " clauses but found " + new_clauses.size());
        }
        for (int i = 0; i < NUM_CLAUSES; i++) {
            if (new_clauses.get(i).getType() != slot_types[i]) {
                throw new InternalError("clause slot " + i + " expects " +
                        slot_types[i] + " but found " +
                        new_clauses.get(i).getType());
            }
        }
        replaceClauses(new_clauses);
    }

    /**
    * Recomputes the clauses from the current body, attaches them and returns
    * the begin directive. On failure the previous clauses stay attached.
    *
    * @param config the naming configuration for synthesized terms.
    * @return {@code omp task} followed by the non-empty clauses.
    * @throws TaskClauseException if the clauses cannot be inferred.
    */
    public String beginString(TaskClauseConfig config)
            throws TaskClauseException {
        TaskClauseMaterializer.materialize(this, config);
        return getDirectiveText();
    }

    @Override
    public String getDirectiveText() {
        return "omp task" + clausesToString();
    }

    @Override
    public String endString() {
        return "omp end task";
    }

    /** A task region must be inside a serial region. */
    @Override
    public void validateGlobalConstraints() throws TaskClauseException {
        if (IRTools.getAncestorOfType(this, SerialRegion.class) == null) {
            throw new TaskClauseException(
                    TaskClauseException.Reason.INVALID_NESTING,
                    "omp task must be inside an OMP serial region",
                    this, null);
        }
    }

}
