package vcsimp.hir;

import java.io.PrintWriter;

/** A reference to a local or quantified variable. */
public class Identifier extends Expression {

    private final Symbol symbol;

    public Identifier(Symbol symbol, Type type) {
        super(type);
        if (symbol == null) {
            throw new IllegalArgumentException("identifier without a symbol");
        }
        this.symbol = symbol;
    }

    /** Returns the referenced symbol. */
    public Symbol getSymbol() {
        return symbol;
    }

    public void print(PrintWriter o) {
        o.print(symbol.getName());
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return symbol.equals(((Identifier)other).symbol);
    }

    @Override
    protected int hashNode() {
        return symbol.hashCode();
    }

}
