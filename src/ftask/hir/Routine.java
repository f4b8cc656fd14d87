package ftask.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
* A subroutine: a named scope that declares variables and owns a body.
*/
public class Routine implements SymbolTable {

    private Traversable parent;

    private List<Traversable> children;

    private String name;

    private Map<String, Symbol> symbol_table;

    /**
    * Creates a routine.
    *
    * @param name the routine name.
    * @param body the statements of the routine.
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public Routine(String name, CompoundStatement body) {
        if (body.getParent() != null) {
            throw new NotAnOrphanException(getClass().getName());
        }
        this.name = name;
        parent = null;
        children = new ArrayList<Traversable>(1);
        children.add(body);
        body.setParent(this);
        symbol_table = SymbolTools.newTable();
    }

    public String getName() {
        return name;
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    /**
    * Declares a new variable in the routine and returns it.
    *
    * @param name the variable name.
    * @param rank the number of dimensions, 0 for scalars.
    * @return the declared symbol.
    * @throws DuplicateSymbolException if the name is already declared here.
    */
    public VariableSymbol declare(String name, int rank) {
        VariableSymbol ret = new VariableSymbol(name, rank);
        addSymbol(ret);
        return ret;
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

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * The body of a routine can be replaced but not removed.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Routines do not support removal of the body.");
    }

    public void setChild(int index, Traversable t) {
        if (index != 0 || !(t instanceof CompoundStatement)) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(0).setParent(null);
        children.set(0, t);
        t.setParent(this);
    }

    public void print(PrintWriter o) {
        o.print("subroutine ");
        o.print(name);
        o.print("\n");
        String body = getBody().toString();
        if (body.length() > 0) {
            o.print(Tools.indent(body, "  "));
            o.print("\n");
        }
        o.print("end subroutine ");
        o.print(name);
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(200);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
