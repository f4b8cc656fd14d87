package ftask.hir;

/**
* <b>PrintTools</b> prints debug and status messages to {@link System#err}
* filtered by the verbosity level set by the driver.
*/
public final class PrintTools {

    /** Global verbosity taken from the command-line option */
    private static int verbosity = 0;

    private PrintTools() {
    }

    /** Returns the current verbosity level. */
    public static int getVerbosity() {
        return verbosity;
    }

    /**
    * Sets the verbosity level; negative values are treated as zero.
    *
    * @param level the new verbosity.
    */
    public static void setVerbosity(int level) {
        verbosity = (level < 0) ? 0 : level;
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is at least {@code min_verbosity}.
    * String composition happens only if the verbosity level is met.
    *
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= verbosity && items.length > 0) {
            StringBuilder sb = new StringBuilder(80);
            sb.append(items[0]);
            for (int i = 1; i < items.length; i++) {
                sb.append(" ").append(items[i]);
            }
            System.err.println(sb.toString());
        }
    }

}
