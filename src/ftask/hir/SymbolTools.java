package ftask.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
* Utilities for symbol lookup and for mapping references to the symbols they
* name.
*/
public final class SymbolTools {

    private SymbolTools() {
    }

    /**
    * Searches the symbol tables enclosing {@code where}, innermost first, for
    * the given name.
    *
    * @param where the IR node from which the search starts.
    * @param name the name being searched for.
    * @return the symbol, or null if no enclosing table declares the name.
    */
    public static Symbol findSymbol(Traversable where, String name) {
        Traversable t = where;
        while (t != null) {
            if (t instanceof SymbolTable) {
                Symbol ret = ((SymbolTable)t).findLocalSymbol(name);
                if (ret != null) {
                    return ret;
                }
            }
            t = t.getParent();
        }
        return null;
    }

    /**
    * Returns the symbol a reference acts on: the identifier's own symbol,
    * the array of an array access, or the base variable of a structure
    * component access.
    *
    * @param e the reference.
    * @return the symbol, or null if {@code e} is not a reference.
    */
    public static Symbol getSymbolOf(Expression e) {
        if (e instanceof Identifier) {
            return ((Identifier)e).getSymbol();
        } else if (e instanceof ArrayAccess) {
            return getSymbolOf(((ArrayAccess)e).getArrayName());
        } else if (e instanceof AccessExpression) {
            return getSymbolOf(((AccessExpression)e).getRootBase());
        }
        return null;
    }

    /** Checks if the symbol has at least one dimension. */
    public static boolean isArray(Symbol symbol) {
        return symbol.getRank() > 0;
    }

    /** Checks if the symbol is a scalar. */
    public static boolean isScalar(Symbol symbol) {
        return symbol.getRank() == 0;
    }

    /**
    * Orders symbols by name, ignoring case, for reproducible output.
    */
    public static List<Symbol> sortByName(List<? extends Symbol> symbols) {
        List<Symbol> ret = new ArrayList<Symbol>(symbols);
        Collections.sort(ret, new Comparator<Symbol>() {
            public int compare(Symbol s1, Symbol s2) {
                return s1.getSymbolName().compareToIgnoreCase(
                        s2.getSymbolName());
            }
        });
        return ret;
    }

    // Shared storage for the symbol tables.
    static void addSymbol(Map<String, Symbol> table, Symbol symbol) {
        String key = symbol.getSymbolName().toLowerCase(Locale.ROOT);
        if (table.containsKey(key)) {
            throw new DuplicateSymbolException(
                    symbol.getSymbolName() + " is already declared");
        }
        table.put(key, symbol);
    }

    static Symbol findLocalSymbol(Map<String, Symbol> table, String name) {
        return table.get(name.toLowerCase(Locale.ROOT));
    }

    static Map<String, Symbol> newTable() {
        return new LinkedHashMap<String, Symbol>(8);
    }

}
