package ftask.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Locale;

/**
* <b>NameID</b> is a plain name that is not linked to a declared symbol; it is
* used for the member part of a structure component reference, {@code s%f}.
* Names compare case-insensitively.
*/
public class NameID extends IDExpression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = NameID.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError(e.getMessage());
        }
    }

    private String name;

    /**
    * Constructs a name with the given string.
    *
    * @param name the raw string name.
    */
    public NameID(String name) {
        object_print_method = class_print_method;
        this.name = name;
    }

    @Override
    public NameID clone() {
        NameID o = (NameID)super.clone();
        o.name = name;
        return o;
    }

    public static void defaultPrint(NameID i, PrintWriter o) {
        o.print(i.name);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof NameID && ((NameID)o).name.equalsIgnoreCase(name));
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    public String getName() {
        return name;
    }

}
