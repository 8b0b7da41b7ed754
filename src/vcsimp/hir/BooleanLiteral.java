package vcsimp.hir;

import java.io.PrintWriter;

/** Represents a boolean constant. */
public class BooleanLiteral extends Literal {

    public static final BooleanLiteral TRUE = new BooleanLiteral(true);

    public static final BooleanLiteral FALSE = new BooleanLiteral(false);

    private final boolean value;

    public BooleanLiteral(boolean value) {
        super(PrimitiveType.BOOL);
        this.value = value;
    }

    /** Returns the shared literal for the given value. */
    public static BooleanLiteral valueOf(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    public void print(PrintWriter o) {
        o.print(value ? "true" : "false");
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return value == ((BooleanLiteral)other).value;
    }

    @Override
    protected int hashNode() {
        return value ? 1231 : 1237;
    }

}
