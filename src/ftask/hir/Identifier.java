package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* <b>Identifier</b> represents a reference to a declared variable. Every
* identifier is linked to the {@link Symbol} it names, so two identifiers are
* equal exactly when they name the same symbol; renaming the symbol renames
* every identifier built from it.
*/
public class Identifier extends IDExpression {

    /** Default print method for Identifier object */
    private static Method class_print_method;

    /** Assigns default print method */
    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = Identifier.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError(e.getMessage());
        }
    }

    /** Reference to the relevant symbol object. */
    private Symbol symbol;

    /**
    * Constructs and returns a new <b>Identifier</b> with the given
    * <b>Symbol</b> object.
    *
    * @param symbol the relevant symbol object.
    * @throws IllegalArgumentException if <b>symbol</b> is null.
    */
    public Identifier(Symbol symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("identifier without a symbol");
        }
        object_print_method = class_print_method;
        this.symbol = symbol;
    }

    /**
    * Returns a clone of this identifier. The clone is linked to the same
    * symbol.
    */
    @Override
    public Identifier clone() {
        Identifier o = (Identifier)super.clone();
        o.symbol = this.symbol;
        return o;
    }

    /**
    * Prints an identifier to a stream.
    *
    * @param i The identifier to print.
    * @param o The writer on which to print the identifier.
    */
    public static void defaultPrint(Identifier i, PrintWriter o) {
        o.print(i.getName());
    }

    /** Returns a string representation of this identifier. */
    @Override
    public String toString() {
        return getName();
    }

    /**
    * Checks if the given object is an identifier naming the same symbol.
    */
    @Override
    public boolean equals(Object o) {
        return (o instanceof Identifier && ((Identifier)o).symbol == symbol);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(symbol);
    }

    /* IDExpression */
    public String getName() {
        return symbol.getSymbolName();
    }

    /**
    * Returns the symbol object linked to this identifier.
    *
    * @return the symbol.
    */
    public Symbol getSymbol() {
        return symbol;
    }

}
