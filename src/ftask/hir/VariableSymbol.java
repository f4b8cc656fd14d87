package ftask.hir;

/**
* A declared variable: a scalar when the rank is 0, an array otherwise.
* Structure variables are scalars or arrays like any other; their components
* are accessed through {@link AccessExpression}.
*/
public class VariableSymbol implements Symbol {

    private final String name;

    private final int rank;

    /**
    * Creates a scalar variable.
    *
    * @param name the declared name.
    */
    public VariableSymbol(String name) {
        this(name, 0);
    }

    /**
    * Creates a variable with the given number of dimensions.
    *
    * @param name the declared name.
    * @param rank the number of dimensions, 0 for a scalar.
    * @throws IllegalArgumentException if the name is empty or the rank is
    * negative.
    */
    public VariableSymbol(String name, int rank) {
        if (name == null || name.length() == 0 || rank < 0) {
            throw new IllegalArgumentException(
                    "invalid variable " + name + " of rank " + rank);
        }
        this.name = name;
        this.rank = rank;
    }

    public String getSymbolName() {
        return name;
    }

    public int getRank() {
        return rank;
    }

    /** Checks if the variable has at least one dimension. */
    public boolean isArray() {
        return rank > 0;
    }

    @Override
    public String toString() {
        return name;
    }

}
