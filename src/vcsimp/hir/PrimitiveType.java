package vcsimp.hir;

import java.io.PrintWriter;
import java.math.BigInteger;

/**
* Built-in scalar types. Like the operators, every primitive type is a shared
* static instance and instances are compared by identity.
*/
public final class PrimitiveType extends Type {

    private static String[] names = {
            "bool", "u8", "u16", "u32", "u64", "u128", "u256", "num", "address"};

    private static int[] widths = {0, 8, 16, 32, 64, 128, 256, 0, 0};

    public static final PrimitiveType BOOL = new PrimitiveType(0);

    public static final PrimitiveType U8 = new PrimitiveType(1);

    public static final PrimitiveType U16 = new PrimitiveType(2);

    public static final PrimitiveType U32 = new PrimitiveType(3);

    public static final PrimitiveType U64 = new PrimitiveType(4);

    public static final PrimitiveType U128 = new PrimitiveType(5);

    public static final PrimitiveType U256 = new PrimitiveType(6);

    /** Unbounded mathematical integer used in specifications. */
    public static final PrimitiveType NUM = new PrimitiveType(7);

    public static final PrimitiveType ADDRESS = new PrimitiveType(8);

    private final int value;

    private final BigInteger max_value;

    private PrimitiveType(int value) {
        this.value = value;
        if (widths[value] > 0) {
            max_value = BigInteger.ONE.shiftLeft(widths[value]).subtract(
                    BigInteger.ONE);
        } else {
            max_value = null;
        }
    }

    /** Returns the bit width of an unsigned type, or 0 for other types. */
    public int getWidth() {
        return widths[value];
    }

    /**
    * Returns the largest value of a bounded integer type.
    *
    * @return the maximum, or null if the type is not a bounded integer.
    */
    public BigInteger getMaxValue() {
        return max_value;
    }

    /**
    * Returns the smallest value of a bounded integer type.
    *
    * @return the minimum, or null if the type is not a bounded integer.
    */
    public BigInteger getMinValue() {
        return (max_value == null) ? null : BigInteger.ZERO;
    }

    @Override
    public boolean isUnsignedInt() {
        return widths[value] > 0;
    }

    @Override
    public boolean isNumber() {
        return widths[value] > 0 || this == NUM;
    }

    @Override
    public boolean isBool() {
        return this == BOOL;
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

}
