package vcsimp.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
* Layout of a struct: its fields ordered by offset and whether it is an enum
* style struct with variants. Structs with variants have no single pack
* layout and are excluded from field-wise reasoning.
*/
public final class StructDecl {

    private final String name;

    private final List<FieldDecl> fields;

    private final boolean has_variants;

    public StructDecl(String name, List<FieldDecl> fields,
            boolean has_variants) {
        this.name = name;
        List<FieldDecl> sorted = new ArrayList<FieldDecl>(fields);
        Collections.sort(sorted, new Comparator<FieldDecl>() {
            public int compare(FieldDecl f1, FieldDecl f2) {
                return f1.getOffset() - f2.getOffset();
            }
        });
        this.fields = Collections.unmodifiableList(sorted);
        this.has_variants = has_variants;
    }

    public String getName() {
        return name;
    }

    /** Returns the struct type of values of this declaration. */
    public StructType getType() {
        return new StructType(name);
    }

    /** Returns the fields in offset order. */
    public List<FieldDecl> getFields() {
        return fields;
    }

    public boolean hasVariants() {
        return has_variants;
    }

    /**
    * Returns the field with the given name.
    *
    * @throws IllegalArgumentException if the struct has no such field.
    */
    public FieldDecl getField(String field_name) {
        for (FieldDecl field : fields) {
            if (field.getName().equals(field_name)) {
                return field;
            }
        }
        throw new IllegalArgumentException(
                "struct " + name + " has no field " + field_name);
    }

}
