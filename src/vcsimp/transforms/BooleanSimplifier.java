package vcsimp.transforms;

import vcsimp.analysis.ComparisonReasoner;
import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.Operator;

/**
* Constructors of boolean connectives that simplify while they build. Each
* method takes operands that are already simplified and returns either a
* reduced expression or the plain connective over the operands.
*/
public final class BooleanSimplifier {

    private BooleanSimplifier() {
    }

    /**
    * Applies the rule of a boolean connective to the given operands.
    *
    * @return the simplified expression, or null if the operator is not a
    *   boolean connective.
    */
    public static Expression simplify(Operator op, Expression... args) {
        if (op == Operator.NOT) {
            return mkNot(args[0]);
        } else if (op == Operator.AND) {
            return mkAnd(args[0], args[1]);
        } else if (op == Operator.OR) {
            return mkOr(args[0], args[1]);
        } else if (op == Operator.IMPLIES) {
            return mkImplies(args[0], args[1]);
        } else if (op == Operator.IFF) {
            return mkIff(args[0], args[1]);
        }
        return null;
    }

    /**
    * Negation: literals flip, double negation cancels, {@code !(0 < x)} for
    * unsigned x becomes {@code x == 0}, and comparisons are replaced by
    * their negated operator.
    */
    public static Expression mkNot(Expression e) {
        if (ExpressionTools.isBoolConst(e, true)) {
            return ExpressionFactory.mkBool(false);
        } else if (ExpressionTools.isBoolConst(e, false)) {
            return ExpressionFactory.mkBool(true);
        }
        if (!(e instanceof CallExpression)) {
            return ExpressionFactory.mkNot(e);
        }
        CallExpression call = (CallExpression)e;
        Operator op = call.getOperator();
        if (op == Operator.NOT) {
            return call.getArgument(0);
        }
        if (op == Operator.LT && ExpressionTools.isNumConst(call.getArgument(0), 0)
            && call.getArgument(1).getType().isUnsignedInt()) {
            Expression x = call.getArgument(1);
            return ExpressionFactory.mkEq(x,
                    ExpressionFactory.mkNumber(0, x.getType()));
        }
        if (op.isComparison()) {
            return ExpressionFactory.mkBoolCall(op.negate(),
                    call.getArgument(0), call.getArgument(1));
        }
        return ExpressionFactory.mkNot(e);
    }

    /**
    * Conjunction. Besides the literal and idempotence rules, the stronger of
    * two comparisons is kept, a conjunction keeps its shape when one of its
    * conjuncts implies the other operand, and a pair of bounds may collapse
    * to an equality or to false.
    */
    public static Expression mkAnd(Expression e1, Expression e2) {
        if (ExpressionTools.isBoolConst(e1, true)) {
            return e2;
        }
        if (ExpressionTools.isBoolConst(e2, true)) {
            return e1;
        }
        if (ExpressionTools.isBoolConst(e1, false) ||
            ExpressionTools.isBoolConst(e2, false)) {
            return ExpressionFactory.mkBool(false);
        }
        if (e1.equals(e2)) {
            return e1;
        }
        if (ComparisonReasoner.isComplementary(e1, e2)) {
            return ExpressionFactory.mkBool(false);
        }
        if (ComparisonReasoner.impliesComparison(e2, e1)) {
            return e2;
        }
        if (ComparisonReasoner.impliesComparison(e1, e2)) {
            return e1;
        }
        if (ComparisonReasoner.conjunctionImpliesComparison(e2, e1)) {
            return e2;
        }
        if (ComparisonReasoner.conjunctionImpliesComparison(e1, e2)) {
            return e1;
        }
        Expression ret = ComparisonReasoner.tryAntisymmetryToEq(e1, e2);
        if (ret == null) {
            ret = ComparisonReasoner.tryPinchToEq(e1, e2);
        }
        if (ret == null) {
            ret = ComparisonReasoner.tryEmptyRange(e1, e2);
        }
        if (ret == null) {
            ret = ExpressionFactory.mkAnd(e1, e2);
        }
        return ret;
    }

    /** Disjunction; of two comparisons the weaker one is kept. */
    public static Expression mkOr(Expression e1, Expression e2) {
        if (ExpressionTools.isBoolConst(e1, false)) {
            return e2;
        }
        if (ExpressionTools.isBoolConst(e2, false)) {
            return e1;
        }
        if (ExpressionTools.isBoolConst(e1, true) ||
            ExpressionTools.isBoolConst(e2, true)) {
            return ExpressionFactory.mkBool(true);
        }
        if (e1.equals(e2)) {
            return e1;
        }
        if (ComparisonReasoner.isComplementary(e1, e2)) {
            return ExpressionFactory.mkBool(true);
        }
        if (ComparisonReasoner.impliesComparison(e1, e2)) {
            return e2;
        }
        if (ComparisonReasoner.impliesComparison(e2, e1)) {
            return e1;
        }
        return ExpressionFactory.mkOr(e1, e2);
    }

    /**
    * Implication. A right-nested implication {@code a ==> (b ==> c)} is
    * flattened to {@code (a && b) ==> c}, dropping a when it repeats b or is
    * implied by it, and collapsing to true when a contradicts b.
    */
    public static Expression mkImplies(Expression e1, Expression e2) {
        if (ExpressionTools.isBoolConst(e1, true)) {
            return e2;
        }
        if (ExpressionTools.isBoolConst(e1, false) ||
            ExpressionTools.isBoolConst(e2, true)) {
            return ExpressionFactory.mkBool(true);
        }
        if (ExpressionTools.isBoolConst(e2, false)) {
            return mkNot(e1);
        }
        if (ExpressionTools.isCallOf(e2, Operator.IMPLIES)) {
            Expression b = ((CallExpression)e2).getArgument(0);
            Expression c = ((CallExpression)e2).getArgument(1);
            if (ComparisonReasoner.isComplementary(e1, b)) {
                return ExpressionFactory.mkBool(true);
            } else if (e1.equals(b)) {
                return mkImplies(e1, c);
            } else if (ComparisonReasoner.impliesComparison(b, e1)) {
                return mkImplies(b, c);
            } else {
                return mkImplies(mkAnd(e1, b), c);
            }
        }
        return ExpressionFactory.mkImplies(e1, e2);
    }

    public static Expression mkIff(Expression e1, Expression e2) {
        if (e1.equals(e2)) {
            return ExpressionFactory.mkBool(true);
        }
        if (ExpressionTools.isBoolConst(e1, true)) {
            return e2;
        } else if (ExpressionTools.isBoolConst(e2, true)) {
            return e1;
        } else if (ExpressionTools.isBoolConst(e1, false)) {
            return mkNot(e2);
        } else if (ExpressionTools.isBoolConst(e2, false)) {
            return mkNot(e1);
        }
        return ExpressionFactory.mkIff(e1, e2);
    }

    /**
    * Conjunction of a list of already simplified expressions, folded from
    * the left with {@link #mkAnd}; true for an empty list.
    */
    public static Expression mkAndAll(Iterable<Expression> conjuncts) {
        Expression ret = null;
        for (Expression e : conjuncts) {
            ret = (ret == null) ? e : mkAnd(ret, e);
        }
        return (ret == null) ? ExpressionFactory.mkBool(true) : ret;
    }
}
