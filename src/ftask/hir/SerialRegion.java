package ftask.hir;

import ftask.analysis.TaskClauseException;

/**
* A region executed by one thread of the enclosing parallel region, either
* {@code omp single} (optionally without the closing barrier) or
* {@code omp master}.
*/
public class SerialRegion extends DirectiveRegion {

    /** The two kinds of serial region. */
    public enum Kind {
        SINGLE, MASTER
    }

    private final Kind kind;

    private final boolean nowait;

    /**
    * Creates an {@code omp single} region.
    *
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public SerialRegion(CompoundStatement body) {
        this(body, Kind.SINGLE, false);
    }

    /**
    * Creates a serial region.
    *
    * @param body the statements of the region.
    * @param kind single or master.
    * @param nowait drops the barrier at the end of a single region.
    * @throws IllegalArgumentException if nowait is requested for master.
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public SerialRegion(CompoundStatement body, Kind kind, boolean nowait) {
        super(body);
        if (kind == Kind.MASTER && nowait) {
            throw new IllegalArgumentException(
                    "nowait does not apply to a master region");
        }
        this.kind = kind;
        this.nowait = nowait;
    }

    @Override
    public SerialRegion clone() {
        return (SerialRegion)super.clone();
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNowait() {
        return nowait;
    }

    @Override
    public String getDirectiveText() {
        return (kind == Kind.SINGLE) ? "omp single" : "omp master";
    }

    @Override
    public String endString() {
        if (kind == Kind.MASTER) {
            return "omp end master";
        }
        return nowait ? "omp end single nowait" : "omp end single";
    }

    /**
    * A serial region must be inside a parallel region and not inside
    * another serial region.
    */
    @Override
    public void validateGlobalConstraints() throws TaskClauseException {
        if (IRTools.getAncestorOfType(this, ParallelRegion.class) == null) {
            throw new TaskClauseException(
                    TaskClauseException.Reason.INVALID_NESTING,
                    "omp " + kind.name().toLowerCase() +
                    " must be inside an OMP parallel region", this, null);
        }
        if (IRTools.getAncestorOfType(this, SerialRegion.class) != null) {
            throw new TaskClauseException(
                    TaskClauseException.Reason.INVALID_NESTING,
                    "omp " + kind.name().toLowerCase() +
                    " must not be inside another OpenMP serial region",
                    this, null);
        }
    }

}
