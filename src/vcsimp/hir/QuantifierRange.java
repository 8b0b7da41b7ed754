package vcsimp.hir;

/**
* One binder of a quantifier: the bound symbol, its type and the domain it
* ranges over (usually the type domain of its type).
*/
public final class QuantifierRange {

    private final Symbol symbol;

    private final Type type;

    private final Expression domain;

    public QuantifierRange(Symbol symbol, Type type, Expression domain) {
        if (symbol == null || type == null || domain == null) {
            throw new IllegalArgumentException("incomplete quantifier range");
        }
        this.symbol = symbol;
        this.type = type;
        this.domain = domain;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    /** Returns the type of the bound variable. */
    public Type getType() {
        return type;
    }

    public Expression getDomain() {
        return domain;
    }

    /** Returns a copy of this range over a different domain. */
    public QuantifierRange withDomain(Expression new_domain) {
        return new QuantifierRange(symbol, type, new_domain);
    }

    @Override
    public String toString() {
        if (domain instanceof CallExpression &&
            ((CallExpression)domain).getOperator() == Operator.TYPE_DOMAIN) {
            return symbol + ": " + type;
        }
        return symbol + " in " + domain;
    }

}
