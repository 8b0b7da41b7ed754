package vcsimp.hir;

/** A field of a struct declaration with its position in the layout. */
public final class FieldDecl {

    private final String name;

    private final int offset;

    private final Type type;

    public FieldDecl(String name, int offset, Type type) {
        this.name = name;
        this.offset = offset;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    /** Returns the position of the field among the pack arguments. */
    public int getOffset() {
        return offset;
    }

    public Type getType() {
        return type;
    }

}
