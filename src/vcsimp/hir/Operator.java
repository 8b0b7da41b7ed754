package vcsimp.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Operators of {@link CallExpression}. The fixed operators are provided as
* static members; operators that carry data (struct operations and spec
* function calls) are subclasses created on demand.
*/
public class Operator implements Printable {

    private static HashMap<String, Operator> op_map =
            new HashMap<String, Operator>(64);

    protected static String[] names = {
            "+", "-", "*", "/", "%", "==", "!=", "<", "<=", ">", ">=",
            "&&", "||", "!", "==>", "<==>", "old", "freeze", "well_formed",
            "abort_flag", "max_u8", "max_u16", "max_u32", "max_u64",
            "max_u128", "max_u256", "type_domain", "pack", "select",
            "update_field", "spec_fun"};

    /**
    * +
    */
    public static final Operator ADD = new Operator(0);

    /**
    * -
    */
    public static final Operator SUB = new Operator(1);

    /**
    * *
    */
    public static final Operator MUL = new Operator(2);

    /**
    * /
    */
    public static final Operator DIV = new Operator(3);

    /**
    * %
    */
    public static final Operator MOD = new Operator(4);

    /**
    * ==
    */
    public static final Operator EQ = new Operator(5);

    /**
    * &#33;=
    */
    public static final Operator NEQ = new Operator(6);

    /**
    * &lt;
    */
    public static final Operator LT = new Operator(7);

    /**
    * &lt;=
    */
    public static final Operator LE = new Operator(8);

    /**
    * &gt;
    */
    public static final Operator GT = new Operator(9);

    /**
    * &gt;=
    */
    public static final Operator GE = new Operator(10);

    /**
    * &amp;&amp;
    */
    public static final Operator AND = new Operator(11);

    /**
    * ||
    */
    public static final Operator OR = new Operator(12);

    /**
    * &#33;
    */
    public static final Operator NOT = new Operator(13);

    /**
    * ==&gt;
    */
    public static final Operator IMPLIES = new Operator(14);

    /**
    * &lt;==&gt;
    */
    public static final Operator IFF = new Operator(15);

    /** Pre-state value of its argument. */
    public static final Operator OLD = new Operator(16);

    /** Converts a mutable reference to an immutable one. */
    public static final Operator FREEZE = new Operator(17);

    public static final Operator WELL_FORMED = new Operator(18);

    public static final Operator ABORT_FLAG = new Operator(19);

    public static final Operator MAX_U8 = new Operator(20);

    public static final Operator MAX_U16 = new Operator(21);

    public static final Operator MAX_U32 = new Operator(22);

    public static final Operator MAX_U64 = new Operator(23);

    public static final Operator MAX_U128 = new Operator(24);

    public static final Operator MAX_U256 = new Operator(25);

    /** The domain of all values of a type, used as a quantifier range. */
    public static final Operator TYPE_DOMAIN = new Operator(26);

    protected static final int PACK_CODE = 27;

    protected static final int SELECT_CODE = 28;

    protected static final int UPDATE_FIELD_CODE = 29;

    protected static final int SPEC_FUN_CODE = 30;

    private static final PrimitiveType[] max_types = {
            PrimitiveType.U8, PrimitiveType.U16, PrimitiveType.U32,
            PrimitiveType.U64, PrimitiveType.U128, PrimitiveType.U256};

    protected int value;

    /**
    * Used by subclasses carrying additional data.
    *
    * @param value The numeric code of the operator.
    * @param shared unused marker that keeps the constructor distinct.
    */
    protected Operator(int value, boolean shared) {
        this.value = value;
    }

    /**
    * Used internally -- you may not create arbitrary operators and may only
    * use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private Operator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns a fixed operator that matches the specified string <tt>s</tt>.
    * @param s the string to be matched.
    * @return the matching operator or null if not found.
    */
    public static Operator fromString(String s) {
        return op_map.get(s);
    }

    /** Checks if this is one of the six comparison operators. */
    public boolean isComparison() {
        return (value >= 5 && value <= 10);
    }

    /** Checks if this is one of the ordering comparisons (&lt; &lt;= &gt; &gt;=). */
    public boolean isOrdering() {
        return (value >= 7 && value <= 10);
    }

    /** Checks if this is an arithmetic operator. */
    public boolean isArithmetic() {
        return (value >= 0 && value <= 4);
    }

    /** Checks if this is a boolean connective. */
    public boolean isLogical() {
        return (value >= 11 && value <= 15);
    }

    /** Checks if this is one of the niladic MAX_U* operators. */
    public boolean isMaxConstant() {
        return (value >= 20 && value <= 25);
    }

    /** Checks if this operator is printed between its two arguments. */
    public boolean isInfix() {
        return (value <= 12 || value == 14 || value == 15);
    }

    /**
    * Returns the unsigned type whose maximum a MAX_U* operator denotes.
    *
    * @return the type, or null if this is not a MAX_U* operator.
    */
    public PrimitiveType getMaxType() {
        return isMaxConstant() ? max_types[value - 20] : null;
    }

    /**
    * Returns the comparison that holds exactly when this one does not:
    * &lt; and &gt;=, &lt;= and &gt;, == and != are swapped.
    *
    * @return the negated comparison, or null for other operators.
    */
    public Operator negate() {
        if (this == LT) {
            return GE;
        } else if (this == LE) {
            return GT;
        } else if (this == GT) {
            return LE;
        } else if (this == GE) {
            return LT;
        } else if (this == EQ) {
            return NEQ;
        } else if (this == NEQ) {
            return EQ;
        }
        return null;
    }

    /**
    * Returns the comparison obtained by swapping the operands: &lt; and &gt;,
    * &lt;= and &gt;= are swapped while == and != stay.
    *
    * @return the flipped comparison; other operators are returned unchanged.
    */
    public Operator flip() {
        if (this == LT) {
            return GT;
        } else if (this == GT) {
            return LT;
        } else if (this == LE) {
            return GE;
        } else if (this == GE) {
            return LE;
        }
        return this;
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

    /* Fixed operators are unique static objects; subclasses override
       equals and hashCode. */

}
