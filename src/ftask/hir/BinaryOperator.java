package ftask.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Infix operators that act on two expressions.
*/
public class BinaryOperator implements Printable {

    private static HashMap<String, BinaryOperator> op_map =
            new HashMap<String, BinaryOperator>(16);

    private static String[] names = {
            "+", "-", "*", "/", "**", "==", "/=", "<", "<=", ">", ">=",
            " .and. ", " .or. "};

    /**
    * +
    */
    public static final BinaryOperator ADD = new BinaryOperator(0);

    /**
    * -
    */
    public static final BinaryOperator SUBTRACT = new BinaryOperator(1);

    /**
    * *
    */
    public static final BinaryOperator MULTIPLY = new BinaryOperator(2);

    /**
    * /
    */
    public static final BinaryOperator DIVIDE = new BinaryOperator(3);

    /**
    * **
    */
    public static final BinaryOperator POWER = new BinaryOperator(4);

    /**
    * ==
    */
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator(5);

    /**
    * /=
    */
    public static final BinaryOperator COMPARE_NE = new BinaryOperator(6);

    /**
    * &lt;
    */
    public static final BinaryOperator COMPARE_LT = new BinaryOperator(7);

    /**
    * &lt;=
    */
    public static final BinaryOperator COMPARE_LE = new BinaryOperator(8);

    /**
    * &gt;
    */
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(9);

    /**
    * &gt;=
    */
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(10);

    /**
    * .and.
    */
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator(11);

    /**
    * .or.
    */
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator(12);

    protected int value;

    /**
    * Used internally -- you may not create arbitrary binary operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private BinaryOperator(int value) {
        this.value = value;
        op_map.put(names[value].trim(), this);
    }

    /**
    * Returns a binary operator that matches the specified string <tt>s</tt>.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static BinaryOperator fromString(String s) {
        return op_map.get(s.trim().toLowerCase());
    }

    /* It is not necessary to override equals or provide cloning, because
       all possible operators are provided as static objects. */

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

    /**
    * Checks if this operator is one of the two additive operators.
    */
    public boolean isAdditive() {
        return (value == 0 || value == 1);
    }

    /**
    * Checks if this operator belongs to binary comparison operator.
    */
    public boolean isCompare() {
        return (value >= 5 && value <= 10);
    }

    /**
    * Checks if this operator belongs to boolean logic operator.
    */
    public boolean isLogical() {
        return (value >= 11 && value <= 12);
    }

}
