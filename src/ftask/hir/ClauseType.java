package ftask.hir;

/**
* The closed set of data-sharing and dependency clauses a directive region
* can carry. The declaration order is the slot order of a task region.
*/
public enum ClauseType {

    PRIVATE("private", null),
    FIRSTPRIVATE("firstprivate", null),
    SHARED("shared", null),
    DEPEND_IN("depend", "in"),
    DEPEND_OUT("depend", "out");

    private final String keyword;

    private final String modifier;

    private ClauseType(String keyword, String modifier) {
        this.keyword = keyword;
        this.modifier = modifier;
    }

    /** Returns the directive keyword, {@code private} or {@code depend}. */
    public String getKeyword() {
        return keyword;
    }

    /** Returns the dependency type of a depend clause, or null. */
    public String getModifier() {
        return modifier;
    }

    /** Checks if entries of this clause are dependency terms. */
    public boolean isDependency() {
        return modifier != null;
    }

}
