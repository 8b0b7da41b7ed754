package vcsimp.hir;

/**
* Key of a substitutable slot: either a local variable symbol or a
* temporary index.
*/
public final class RewriteTarget implements Comparable<RewriteTarget> {

    private final Symbol symbol;

    private final int temp_index;

    private RewriteTarget(Symbol symbol, int temp_index) {
        this.symbol = symbol;
        this.temp_index = temp_index;
    }

    /** Returns the target for a local variable. */
    public static RewriteTarget forLocal(Symbol symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("null symbol");
        }
        return new RewriteTarget(symbol, -1);
    }

    /** Returns the target for a temporary. */
    public static RewriteTarget forTemporary(int index) {
        return new RewriteTarget(null, index);
    }

    /**
    * Returns the target an expression refers to.
    *
    * @return the target of an {@link Identifier} or {@link Temporary}, or
    *   null for any other expression.
    */
    public static RewriteTarget of(Expression e) {
        if (e instanceof Identifier) {
            return forLocal(((Identifier)e).getSymbol());
        } else if (e instanceof Temporary) {
            return forTemporary(((Temporary)e).getIndex());
        }
        return null;
    }

    public boolean isLocal() {
        return symbol != null;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public int getTemporaryIndex() {
        return temp_index;
    }

    public int compareTo(RewriteTarget other) {
        if (isLocal() != other.isLocal()) {
            return isLocal() ? 1 : -1;
        }
        if (isLocal()) {
            return symbol.compareTo(other.symbol);
        }
        return (temp_index < other.temp_index) ? -1 :
                ((temp_index == other.temp_index) ? 0 : 1);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof RewriteTarget &&
                compareTo((RewriteTarget)o) == 0);
    }

    @Override
    public int hashCode() {
        return isLocal() ? symbol.hashCode() : 31 * temp_index + 7;
    }

    @Override
    public String toString() {
        return isLocal() ? symbol.getName() : "$t" + temp_index;
    }

}
