package vcsimp.hir;

import vcsimp.exec.Driver;

import java.io.PrintWriter;
import java.util.List;

/**
* Status messages gated by the {@code verbosity} option, and list printing
* for the expression printers. All messages go to {@link System#err}.
* <p>
* Levels: 1 for pass progress, 2 for quantifier rule applications, 3 for
* every top-level simplification and 4 for rule-level tracing.
*/
public final class PrintTools {

    public static final String line_sep = System.getProperty("line.separator");

    private static int verbosity = readVerbosity();

    private PrintTools() {
    }

    private static int readVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch(NumberFormatException e) {
            throw new IllegalArgumentException(
                    "verbosity must be an integer: " + value, e);
        }
    }

    /** Picks up a changed {@code verbosity} option. */
    public static void updateVerbosity() {
        verbosity = readVerbosity();
    }

    /**
    * Prints the items separated by blanks when the verbosity is at least
    * {@code min_verbosity}. The items are only converted to strings in that
    * case, so callers may pass expressions without guarding the call.
    *
    * @param min_verbosity the level the message belongs to.
    * @param items the message parts, usually a component tag first.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity > verbosity || items.length == 0) {
            return;
        }
        StringBuilder sb = new StringBuilder(80);
        for (Object item : items) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(item);
        }
        System.err.println(sb);
    }

    /** Prints a preformatted message at the given level. */
    public static void printlnStatus(String message, int min_verbosity) {
        if (min_verbosity <= verbosity) {
            System.err.println(message);
        }
    }

    /** Prints the nodes separated by {@code ", "}. */
    public static void printListWithComma(List<? extends Printable> list,
            PrintWriter w) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                w.print(", ");
            }
            list.get(i).print(w);
        }
    }

    /** Joins the string forms of the items with the separator. */
    public static String listToString(List<?> list, String sep) {
        StringBuilder sb = new StringBuilder(80);
        for (Object o : list) {
            if (sb.length() > 0) {
                sb.append(sep);
            }
            sb.append(o);
        }
        return sb.toString();
    }
}
