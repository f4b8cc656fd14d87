package ftask.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
* Represents the entire program, a list of routines. Variables declared in
* the program are visible to every routine.
*/
public class Program implements SymbolTable {

    private List<Traversable> children;

    private Map<String, Symbol> symbol_table;

    /** Creates an empty program. */
    public Program() {
        children = new ArrayList<Traversable>(4);
        symbol_table = SymbolTools.newTable();
    }

    /**
    * Adds a routine to the end of the program.
    *
    * @throws NotAnOrphanException if <b>routine</b> has a parent.
    */
    public void addRoutine(Routine routine) {
        if (routine.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.add(routine);
        routine.setParent(this);
    }

    /** Returns the routine with the given name, ignoring case, or null. */
    public Routine getRoutine(String name) {
        for (Traversable t : children) {
            if (((Routine)t).getName().equalsIgnoreCase(name)) {
                return (Routine)t;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public List<Routine> getRoutines() {
        return (List<Routine>)(List<?>)children;
    }

    public void addSymbol(Symbol symbol) {
        SymbolTools.addSymbol(symbol_table, symbol);
    }

    public Symbol findLocalSymbol(String name) {
        return SymbolTools.findLocalSymbol(symbol_table, name);
    }

    public List<Symbol> getSymbols() {
        return new ArrayList<Symbol>(symbol_table.values());
    }

    public List<Traversable> getChildren() {
        return children;
    }

    /** A program is always the root of the tree. */
    public Traversable getParent() {
        return null;
    }

    /**
    * @throws UnsupportedOperationException always
    */
    public void setParent(Traversable t) {
        throw new UnsupportedOperationException(
                "A program cannot have a parent.");
    }

    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        child.setParent(null);
        children.remove(index);
    }

    public void setChild(int index, Traversable t) {
        if (!(t instanceof Routine) || index < 0 || index >= children.size()) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    /** Prints the routines separated by blank lines. */
    public void print(PrintWriter o) {
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                o.print("\n\n");
            }
            children.get(i).print(o);
        }
        o.print("\n");
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(1000);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
