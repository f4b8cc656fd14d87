package ftask.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data as source code.
* The default print behavior of a class may be overridden at the class level
* (for all subsequently created objects) or for a single object. For
* consistency, {@code toString} of every IR object goes through the same print
* method.
*/
public interface Printable {

    /**
    * Prints the code for the IR represented by the object. If the object's
    * print method is null, nothing is printed; this provides an easy mechanism
    * to temporarily hide something.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
