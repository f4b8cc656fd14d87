package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/** Represents an integer literal in the program. */
public class IntegerLiteral extends Literal {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = IntegerLiteral.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }
    
    private long value;

    /** Constructs an integer literal with the specified numeric value. */
    public IntegerLiteral(long value) {
        object_print_method = class_print_method;
        this.value = value;
    }

    /** Returns a clone of the integer literal. */
    @Override
    public IntegerLiteral clone() {
        IntegerLiteral o = (IntegerLiteral)super.clone();
        o.value = value;
        return o;
    }

    /**
    * Prints a literal to a stream.
    *
    * @param l The literal to print.
    * @param o The writer on which to print the literal.
    */
    public static void defaultPrint(IntegerLiteral l, PrintWriter o) {
        o.print(Long.toString(l.value));
    }

    /** Returns a string representation of the integer literal. */
    @Override
    public String toString() {
        return Long.toString(value);
    }

    /** Compares the integer literal with the specified object for equality. */
    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && value == ((IntegerLiteral)o).value);
    }

    /** Returns the hash code of the integer literal. */
    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.valueOf(value).hashCode();
    }

    /** Returns the numeric value of the integer literal. */
    public long getValue() {
        return value;
    }

}
