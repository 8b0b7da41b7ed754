package vcsimp.hir;

import java.io.PrintWriter;
import java.math.BigInteger;

/** Represents an integer constant of arbitrary precision. */
public class IntegerLiteral extends Literal {

    private final BigInteger value;

    /**
    * Constructs an integer literal with the specified value and type.
    *
    * @throws IllegalArgumentException if the value is null.
    */
    public IntegerLiteral(BigInteger value, Type type) {
        super(type);
        if (value == null) {
            throw new IllegalArgumentException("integer literal without value");
        }
        this.value = value;
    }

    /** Constructs an integer literal with the specified numeric value. */
    public IntegerLiteral(long value, Type type) {
        this(BigInteger.valueOf(value), type);
    }

    /** Returns the numeric value of the literal. */
    public BigInteger getValue() {
        return value;
    }

    /** Checks if this literal holds the given value. */
    public boolean isValue(long v) {
        return value.equals(BigInteger.valueOf(v));
    }

    public void print(PrintWriter o) {
        o.print(value.toString());
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return value.equals(((IntegerLiteral)other).value);
    }

    @Override
    protected int hashNode() {
        return value.hashCode();
    }

}
