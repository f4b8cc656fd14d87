package ftask.hir;

/**
* An IR object that implements Symbol interface is identified as a unique
* symbol in the program. Every {@link Identifier} object has a link to
* its corresponding Symbol object and can access the attributes of the symbol
* object.
*/
public interface Symbol {

    /**
    * Returns the name of the symbol.
    *
    * @return the name of the symbol.
    */
    String getSymbolName();

    /**
    * Returns the number of array dimensions; 0 for a scalar.
    *
    * @return the rank of the symbol.
    */
    int getRank();

}
