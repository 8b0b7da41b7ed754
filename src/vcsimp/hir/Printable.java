package vcsimp.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data. Expressions,
* types and operators print themselves in the infix notation used by log
* messages and test failure reports; {@code toString} is defined in terms of
* {@link #print(PrintWriter)}.
*/
public interface Printable {

    /**
    * Prints the textual form of the object.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
