package ftask.hir;

/**
* Common interface of the loop statements.
*/
public interface Loop {

    /**
    * Returns the statements iterated by the loop.
    *
    * @return the body of the loop.
    */
    CompoundStatement getBody();

}
