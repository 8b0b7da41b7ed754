package vcsimp.analysis;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.Operator;

/**
 * Class OrderRelation represents an ordering comparison in one of two normal
 * forms: "lhs &lt; rhs" or "!(lhs &lt; rhs)". Different operators stating the
 * same fact map to the same relation, e.g. {@code b > a} and {@code a < b}
 * both become the less-than relation (a, b).
 */
public class OrderRelation {

    private final Expression lhs;

    private final Expression rhs;

    private OrderRelation(Expression lhs, Expression rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * Normalizes {@code a < b} and {@code b > a} to the less-than relation
     * (a, b).
     *
     * @param e the comparison.
     * @return the relation, or null if e is not a strict comparison.
     */
    public static OrderRelation lessThan(Expression e) {
        if (!(e instanceof CallExpression)) {
            return null;
        }
        CallExpression call = (CallExpression)e;
        Operator op = call.getOperator();
        if (op == Operator.LT) {
            return new OrderRelation(call.getArgument(0), call.getArgument(1));
        } else if (op == Operator.GT) {
            return new OrderRelation(call.getArgument(1), call.getArgument(0));
        }
        return null;
    }

    /**
     * Normalizes {@code a >= b}, {@code b <= a}, {@code !(a < b)} and
     * {@code !(b > a)} to the not-less-than relation (a, b).
     *
     * @param e the comparison.
     * @return the relation, or null if e is none of these shapes.
     */
    public static OrderRelation notLessThan(Expression e) {
        if (!(e instanceof CallExpression)) {
            return null;
        }
        CallExpression call = (CallExpression)e;
        Operator op = call.getOperator();
        if (op == Operator.LE) {
            return new OrderRelation(call.getArgument(1), call.getArgument(0));
        } else if (op == Operator.GE) {
            return new OrderRelation(call.getArgument(0), call.getArgument(1));
        } else if (op == Operator.NOT) {
            return lessThan(call.getArgument(0));
        }
        return null;
    }

    /**
     * Normalizes {@code a <= b} and {@code b >= a} to (a, b). Negations are
     * not looked through.
     */
    public static OrderRelation lessOrEqual(Expression e) {
        if (!(e instanceof CallExpression)) {
            return null;
        }
        CallExpression call = (CallExpression)e;
        Operator op = call.getOperator();
        if (op == Operator.LE) {
            return new OrderRelation(call.getArgument(0), call.getArgument(1));
        } else if (op == Operator.GE) {
            return new OrderRelation(call.getArgument(1), call.getArgument(0));
        }
        return null;
    }

    /** Returns the smaller side of the relation. */
    public Expression getLHS() {
        return lhs;
    }

    /** Returns the larger side of the relation. */
    public Expression getRHS() {
        return rhs;
    }

    @Override
    public String toString() {
        return "(" + lhs + ", " + rhs + ")";
    }
}
