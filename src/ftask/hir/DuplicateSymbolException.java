package ftask.hir;

/**
* Thrown when a symbol is declared twice within the same symbol table.
*/
public class DuplicateSymbolException extends RuntimeException {

    private static final long serialVersionUID = 3482L;

    public DuplicateSymbolException(String message) {
        super(message);
    }

}
