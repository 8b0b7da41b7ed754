package vcsimp.hir;

import java.io.PrintWriter;

/**
* Struct operations: {@code pack} builds a struct value from its fields in
* offset order, {@code select} reads one field and {@code update_field}
* returns a copy with one field replaced.
*/
public final class StructOperator extends Operator {

    private final String struct_name;

    private final String field_name;

    private StructOperator(int code, String struct_name, String field_name) {
        super(code, false);
        this.struct_name = struct_name;
        this.field_name = field_name;
    }

    /** Returns the pack operator of the given struct. */
    public static StructOperator pack(String struct_name) {
        return new StructOperator(PACK_CODE, struct_name, null);
    }

    /** Returns the operator selecting the given field. */
    public static StructOperator select(String struct_name, String field) {
        return new StructOperator(SELECT_CODE, struct_name, field);
    }

    /** Returns the operator updating the given field. */
    public static StructOperator updateField(String struct_name, String field) {
        return new StructOperator(UPDATE_FIELD_CODE, struct_name, field);
    }

    public boolean isPack() {
        return value == PACK_CODE;
    }

    public boolean isSelect() {
        return value == SELECT_CODE;
    }

    public boolean isUpdateField() {
        return value == UPDATE_FIELD_CODE;
    }

    public String getStructName() {
        return struct_name;
    }

    /** Returns the accessed field, or null for pack. */
    public String getFieldName() {
        return field_name;
    }

    /** Checks if both operators act on the same struct. */
    public boolean sameStruct(StructOperator other) {
        return struct_name.equals(other.struct_name);
    }

    /** Checks if both operators act on the same field of the same struct. */
    public boolean sameField(StructOperator other) {
        return sameStruct(other) && field_name != null &&
                field_name.equals(other.field_name);
    }

    @Override
    public void print(PrintWriter o) {
        o.print(toString());
    }

    @Override
    public String toString() {
        if (field_name == null) {
            return names[value] + "<" + struct_name + ">";
        }
        return names[value] + "<" + struct_name + "." + field_name + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StructOperator)) {
            return false;
        }
        StructOperator other = (StructOperator)o;
        return value == other.value && struct_name.equals(other.struct_name) &&
                (field_name == null ? other.field_name == null :
                field_name.equals(other.field_name));
    }

    @Override
    public int hashCode() {
        int h = 31 * value + struct_name.hashCode();
        return (field_name == null) ? h : 31 * h + field_name.hashCode();
    }

}
