package vcsimp.hir;

import java.io.PrintWriter;

/**
* The type of a value of a declared struct. The layout is looked up in the
* {@link GlobalEnv} by name.
*/
public final class StructType extends Type {

    private final String name;

    public StructType(String name) {
        if (name == null) {
            throw new IllegalArgumentException("struct type without a name");
        }
        this.name = name;
    }

    /** Returns the name of the struct declaration. */
    public String getName() {
        return name;
    }

    public void print(PrintWriter o) {
        o.print(name);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof StructType && name.equals(((StructType)o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

}
