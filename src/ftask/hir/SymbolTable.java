package ftask.hir;

import java.util.List;

/**
* Any IR object that declares names. Lookup of a name is case-insensitive.
*/
public interface SymbolTable extends Traversable {

    /**
    * Declares the symbol in this table.
    *
    * @param symbol the new symbol.
    * @throws DuplicateSymbolException if the name is already declared here.
    */
    void addSymbol(Symbol symbol);

    /**
    * Finds a symbol declared directly in this table.
    *
    * @param name the name being searched for.
    * @return the symbol or null if this table does not declare the name.
    */
    Symbol findLocalSymbol(String name);

    /**
    * Returns the symbols declared in this table, in declaration order.
    */
    List<Symbol> getSymbols();

}
