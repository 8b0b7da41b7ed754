package vcsimp.hir;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
* Base class of the value types attached to expressions. Types are only
* queried, never inferred: every node is built with the type its producer
* assigned to it.
*/
public abstract class Type implements Printable {

    /** Constructor for derived classes. */
    protected Type() {
    }

    /** Checks if this type is one of the fixed-width unsigned integers. */
    public boolean isUnsignedInt() {
        return false;
    }

    /** Checks if this type is numeric (bounded or not). */
    public boolean isNumber() {
        return false;
    }

    /** Checks if this type is the boolean type. */
    public boolean isBool() {
        return false;
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(16);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
