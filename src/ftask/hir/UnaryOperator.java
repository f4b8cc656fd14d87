package ftask.hir;

import java.io.PrintWriter;

/**
* Prefix operators that act on a single expression.
*/
public class UnaryOperator implements Printable {

    private static String[] names = { "-", ".not." };

    /**
    * -
    */
    public static final UnaryOperator MINUS = new UnaryOperator(0);

    /**
    * .not.
    */
    public static final UnaryOperator LOGICAL_NEGATION = new UnaryOperator(1);

    protected int value;

    private UnaryOperator(int value) {
        this.value = value;
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

}
