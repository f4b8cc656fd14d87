package ftask.hir;

import ftask.analysis.TaskClauseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* An {@code omp parallel} region. Variables are shared by default; the
* region carries a single private clause listing the variables each thread
* gets its own copy of.
*/
public class ParallelRegion extends DirectiveRegion {

    /**
    * Creates a parallel region with an empty private clause.
    *
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public ParallelRegion(CompoundStatement body) {
        super(body);
        replaceClauses(Collections.singletonList(
                new Clause(ClauseType.PRIVATE)));
    }

    @Override
    public ParallelRegion clone() {
        return (ParallelRegion)super.clone();
    }

    /** Returns the private clause of the region. */
    public Clause getPrivateClause() {
        return getClauses().get(0);
    }

    /**
    * Replaces the private clause.
    *
    * @param clause the new clause, which must be a private clause.
    * @throws IllegalArgumentException if the clause is of another type.
    */
    public void setPrivateClause(Clause clause) {
        if (clause.getType() != ClauseType.PRIVATE) {
            throw new IllegalArgumentException(
                    "not a private clause: " + clause);
        }
        replaceClauses(Collections.singletonList(clause));
    }

    /** Returns the symbols listed in the private clause. */
    public List<Symbol> getPrivateSymbols() {
        List<Symbol> ret = new ArrayList<Symbol>();
        for (Expression e : getPrivateClause().getItems()) {
            Symbol s = SymbolTools.getSymbolOf(e);
            if (s != null) {
                ret.add(s);
            }
        }
        return ret;
    }

    @Override
    public String getDirectiveText() {
        return "omp parallel default(shared)" + clausesToString();
    }

    @Override
    public String endString() {
        return "omp end parallel";
    }

    /** A parallel region must not be nested in another parallel region. */
    @Override
    public void validateGlobalConstraints() throws TaskClauseException {
        if (IRTools.getAncestorOfType(this, ParallelRegion.class) != null) {
            throw new TaskClauseException(
                    TaskClauseException.Reason.INVALID_NESTING,
                    "Cannot nest OpenMP parallel regions.", this, null);
        }
    }

}
