package ftask.hir;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
* General utilities on lists and strings used by the IR classes.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the position of the specified object in the list, comparing by
    * reference rather than by {@code equals}.
    *
    * @param list the list to be searched.
    * @param o the object to be found.
    * @return the index of {@code o} or -1 if it is not in the list.
    */
    public static int identityIndexOf(List<?> list, Object o) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Joins the string forms of the given items with the separator.
    */
    public static String join(Collection<?> items, String separator) {
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = items.iterator();
        if (iter.hasNext()) {
            sb.append(iter.next());
            while (iter.hasNext()) {
                sb.append(separator).append(iter.next());
            }
        }
        return sb.toString();
    }

    /**
    * Prefixes every non-empty line of {@code text} with {@code margin}.
    */
    public static String indent(String text, String margin) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append("\n");
            }
            if (lines[i].length() > 0) {
                sb.append(margin);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    /**
    * Returns the current system time in seconds.
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }

}
