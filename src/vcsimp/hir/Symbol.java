package vcsimp.hir;

/**
* Name of a local variable, quantified variable or spec function parameter.
* Two symbols with the same name are the same symbol; scoping decides which
* binder an occurrence refers to.
*/
public final class Symbol implements Comparable<Symbol> {

    private final String name;

    public Symbol(String name) {
        if (name == null) {
            throw new IllegalArgumentException("symbol without a name");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public int compareTo(Symbol other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Symbol && name.equals(((Symbol)o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

}
