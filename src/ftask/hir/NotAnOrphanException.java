package ftask.hir;

/**
* Thrown when a node that already has a parent is attached to another parent.
* Clone the node first, or detach it from its current parent.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 3480L;

    public NotAnOrphanException() {
        super();
    }

    public NotAnOrphanException(String message) {
        super(message);
    }

}
