package vcsimp.analysis;

import java.math.BigInteger;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.Operator;

/**
 * Symbolic reasoning about pairs of comparisons. All methods are stateless;
 * the facts they relate are given as arguments. Operands are matched by
 * structural equality, and constants on either side are compared
 * numerically, so that {@code 3 < n} is found to imply {@code 2 < n} and to
 * contradict {@code !(2 < n)}.
 */
public final class ComparisonReasoner {

    private ComparisonReasoner() {
    }

    /**
     * A value split into a base expression and a constant, either additive
     * ({@code base + amount}) or multiplicative ({@code base * amount}).
     */
    private static class Offset {

        private final Expression base;

        private final BigInteger amount;

        private Offset(Expression base, BigInteger amount) {
            this.base = base;
            this.amount = amount;
        }
    }

    private static Offset getAdditiveOffset(Expression e) {
        if (e instanceof CallExpression) {
            CallExpression call = (CallExpression)e;
            if (call.getArguments().size() == 2) {
                BigInteger c = ExpressionTools.getNumConst(call.getArgument(1));
                if (c != null) {
                    if (call.getOperator() == Operator.ADD) {
                        return new Offset(call.getArgument(0), c);
                    } else if (call.getOperator() == Operator.SUB) {
                        return new Offset(call.getArgument(0), c.negate());
                    }
                }
            }
        }
        return new Offset(e, BigInteger.ZERO);
    }

    private static Offset getMultiplicativeFactor(Expression e) {
        if (ExpressionTools.isCallOf(e, Operator.MUL)) {
            CallExpression call = (CallExpression)e;
            BigInteger k = ExpressionTools.getNumConst(call.getArgument(1));
            if (k != null) {
                return new Offset(call.getArgument(0), k);
            }
        }
        return new Offset(e, BigInteger.ONE);
    }

    /**
     * Checks if the truth of {@code stronger} implies the truth of
     * {@code weaker}. Recognized cases:
     * <ul>
     * <li>both sides are less-than (or both not-less-than) relations over the
     *     same operand, and the constants on the other side are ordered
     *     accordingly;</li>
     * <li>both sides compare {@code base + c} against the same operand with
     *     suitably ordered offsets;</li>
     * <li>both sides state {@code base * k >= r} with
     *     {@code 1 <= k_strong <= k_weak} and unsigned {@code base};</li>
     * <li>{@code x == v} implies a strict or non-strict bound on x that v
     *     satisfies;</li>
     * <li>{@code a < b} implies {@code a <= b} and {@code a > b} implies
     *     {@code a >= b}.</li>
     * </ul>
     *
     * @param stronger the known fact.
     * @param weaker the fact to be implied.
     * @return true if the implication is established.
     */
    public static boolean impliesComparison(Expression stronger,
            Expression weaker) {
        OrderRelation s = OrderRelation.lessThan(stronger);
        OrderRelation w = OrderRelation.lessThan(weaker);
        if (s != null && w != null) {
            // c2 < x implies c1 < x when c1 <= c2
            BigInteger c2 = ExpressionTools.getNumConst(s.getLHS());
            BigInteger c1 = ExpressionTools.getNumConst(w.getLHS());
            if (c1 != null && c2 != null && s.getRHS().equals(w.getRHS()) &&
                c1.compareTo(c2) <= 0) {
                return true;
            }
            // x < c1 implies x < c2 when c1 <= c2
            c1 = ExpressionTools.getNumConst(s.getRHS());
            c2 = ExpressionTools.getNumConst(w.getRHS());
            if (c1 != null && c2 != null && s.getLHS().equals(w.getLHS()) &&
                c1.compareTo(c2) <= 0) {
                return true;
            }
            if (s.getRHS().equals(w.getRHS())) {
                Offset so = getAdditiveOffset(s.getLHS());
                Offset wo = getAdditiveOffset(w.getLHS());
                if (so.base.equals(wo.base) &&
                    so.amount.compareTo(wo.amount) >= 0) {
                    return true;
                }
            }
        }
        s = OrderRelation.notLessThan(stronger);
        w = OrderRelation.notLessThan(weaker);
        if (s != null && w != null) {
            // x <= c1 implies x <= c2 when c1 <= c2
            BigInteger c1 = ExpressionTools.getNumConst(s.getLHS());
            BigInteger c2 = ExpressionTools.getNumConst(w.getLHS());
            if (c1 != null && c2 != null && s.getRHS().equals(w.getRHS()) &&
                c1.compareTo(c2) <= 0) {
                return true;
            }
            // x >= c1 implies x >= c2 when c2 <= c1
            c1 = ExpressionTools.getNumConst(s.getRHS());
            c2 = ExpressionTools.getNumConst(w.getRHS());
            if (c1 != null && c2 != null && s.getLHS().equals(w.getLHS()) &&
                c2.compareTo(c1) <= 0) {
                return true;
            }
            if (s.getRHS().equals(w.getRHS())) {
                Offset so = getAdditiveOffset(s.getLHS());
                Offset wo = getAdditiveOffset(w.getLHS());
                if (so.base.equals(wo.base) &&
                    wo.amount.compareTo(so.amount) >= 0) {
                    return true;
                }
                so = getMultiplicativeFactor(s.getLHS());
                wo = getMultiplicativeFactor(w.getLHS());
                if (so.base.equals(wo.base) &&
                    so.amount.compareTo(BigInteger.ONE) >= 0 &&
                    wo.amount.compareTo(so.amount) >= 0 &&
                    so.base.getType().isUnsignedInt()) {
                    return true;
                }
            }
        }
        if (ExpressionTools.isCallOf(stronger, Operator.EQ) &&
            equalityImplies((CallExpression)stronger, weaker)) {
            return true;
        }
        return strictImpliesNonStrict(stronger, weaker);
    }

    private static boolean equalityImplies(CallExpression eq,
            Expression weaker) {
        Expression var = eq.getArgument(0);
        BigInteger val = ExpressionTools.getNumConst(eq.getArgument(1));
        if (val == null) {
            var = eq.getArgument(1);
            val = ExpressionTools.getNumConst(eq.getArgument(0));
            if (val == null) {
                return false;
            }
        }
        OrderRelation w = OrderRelation.lessThan(weaker);
        if (w != null) {
            BigInteger c = ExpressionTools.getNumConst(w.getLHS());
            if (c != null && w.getRHS().equals(var) && c.compareTo(val) < 0) {
                return true;
            }
            c = ExpressionTools.getNumConst(w.getRHS());
            if (c != null && w.getLHS().equals(var) && val.compareTo(c) < 0) {
                return true;
            }
        }
        w = OrderRelation.notLessThan(weaker);
        if (w != null) {
            BigInteger c = ExpressionTools.getNumConst(w.getLHS());
            if (c != null && w.getRHS().equals(var) && c.compareTo(val) >= 0) {
                return true;
            }
            c = ExpressionTools.getNumConst(w.getRHS());
            if (c != null && w.getLHS().equals(var) && val.compareTo(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean strictImpliesNonStrict(Expression stronger,
            Expression weaker) {
        if (!(stronger instanceof CallExpression) ||
            !(weaker instanceof CallExpression)) {
            return false;
        }
        CallExpression s = (CallExpression)stronger;
        CallExpression w = (CallExpression)weaker;
        boolean shape = (s.getOperator() == Operator.LT &&
                w.getOperator() == Operator.LE) ||
                (s.getOperator() == Operator.GT &&
                w.getOperator() == Operator.GE);
        return shape && s.getArguments().equals(w.getArguments());
    }

    /**
     * Checks if some conjunct of a (possibly nested) conjunction implies the
     * target comparison.
     */
    public static boolean conjunctionImpliesComparison(Expression conj,
            Expression target) {
        if (!ExpressionTools.isCallOf(conj, Operator.AND)) {
            return false;
        }
        CallExpression and = (CallExpression)conj;
        return impliesComparison(and.getArgument(0), target) ||
                impliesComparison(and.getArgument(1), target) ||
                conjunctionImpliesComparison(and.getArgument(0), target) ||
                conjunctionImpliesComparison(and.getArgument(1), target);
    }

    /**
     * Checks if {@code a} subsumes {@code b} in a disjunction, i.e. if b
     * implies a so that b is redundant next to a.
     */
    public static boolean subsumes(Expression a, Expression b) {
        if (a.equals(b) || impliesComparison(b, a)) {
            return true;
        }
        if (ExpressionTools.isCallOf(a, Operator.NOT) &&
            ExpressionTools.isCallOf(b, Operator.NOT)) {
            // !x subsumes !y when y subsumes x
            if (subsumes(((CallExpression)b).getArgument(0),
                    ((CallExpression)a).getArgument(0))) {
                return true;
            }
        }
        if (ExpressionTools.isCallOf(b, Operator.AND)) {
            CallExpression and = (CallExpression)b;
            if (subsumes(a, and.getArgument(0)) ||
                subsumes(a, and.getArgument(1))) {
                return true;
            }
        }
        return false;
    }

    /** Checks if one expression is the negation of the other. */
    public static boolean isComplementary(Expression a, Expression b) {
        if (ExpressionTools.isCallOf(a, Operator.NOT)) {
            return ((CallExpression)a).getArgument(0).equals(b);
        }
        if (ExpressionTools.isCallOf(b, Operator.NOT)) {
            return ((CallExpression)b).getArgument(0).equals(a);
        }
        return false;
    }

    /**
     * Checks if the assumption forces {@code e} to be false through one
     * comparison implication under a negation. {@code 3 < x} falsifies
     * {@code !(2 < x)}, and {@code !(3 < x)} falsifies {@code 5 < x}.
     */
    public static boolean impliesComplementary(Expression assumption,
            Expression e) {
        if (ExpressionTools.isCallOf(e, Operator.NOT) &&
            impliesComparison(assumption, ((CallExpression)e).getArgument(0))) {
            return true;
        }
        if (ExpressionTools.isCallOf(assumption, Operator.NOT) &&
            impliesComparison(e, ((CallExpression)assumption).getArgument(0))) {
            return true;
        }
        return false;
    }

    /**
     * Rewrites {@code a <= b && b <= a}, in any orientation of &lt;= and
     * &gt;=, to {@code a == b}.
     *
     * @return the equality, or null if the shapes do not match.
     */
    public static Expression tryAntisymmetryToEq(Expression a, Expression b) {
        OrderRelation ra = OrderRelation.lessOrEqual(a);
        OrderRelation rb = OrderRelation.lessOrEqual(b);
        if (ra == null || rb == null) {
            return null;
        }
        if (ra.getLHS().equals(rb.getRHS()) && ra.getRHS().equals(rb.getLHS())) {
            return ExpressionFactory.mkEq(ra.getLHS(), ra.getRHS());
        }
        return null;
    }

    /**
     * Rewrites a strict bound and a non-strict bound that leave a single
     * integer to an equality: {@code c < x && !(c+1 < x)} becomes
     * {@code x == c+1} and {@code x < c && !(x < c-1)} becomes
     * {@code x == c-1}. Both argument orders are tried.
     *
     * @return the equality, or null if the shapes do not match.
     */
    public static Expression tryPinchToEq(Expression a, Expression b) {
        Expression ret = tryPinchDirected(a, b);
        if (ret == null) {
            ret = tryPinchDirected(b, a);
        }
        return ret;
    }

    private static Expression tryPinchDirected(Expression lt,
            Expression not_lt) {
        if (!ExpressionTools.isCallOf(lt, Operator.LT)) {
            return null;
        }
        CallExpression ltc = (CallExpression)lt;
        Expression e1 = ltc.getArgument(0);
        Expression e2 = ltc.getArgument(1);
        // Only the syntactic shapes !(f1 < f2), f1 >= f2 and f2 <= f1
        Expression f1, f2;
        if (ExpressionTools.isCallOf(not_lt, Operator.NOT)) {
            Expression inner = ((CallExpression)not_lt).getArgument(0);
            if (!ExpressionTools.isCallOf(inner, Operator.LT)) {
                return null;
            }
            f1 = ((CallExpression)inner).getArgument(0);
            f2 = ((CallExpression)inner).getArgument(1);
        } else if (ExpressionTools.isCallOf(not_lt, Operator.GE)) {
            f1 = ((CallExpression)not_lt).getArgument(0);
            f2 = ((CallExpression)not_lt).getArgument(1);
        } else if (ExpressionTools.isCallOf(not_lt, Operator.LE)) {
            f1 = ((CallExpression)not_lt).getArgument(1);
            f2 = ((CallExpression)not_lt).getArgument(0);
        } else {
            return null;
        }
        // c1 < x <= c2 with c2 == c1 + 1
        BigInteger c1 = ExpressionTools.getNumConst(e1);
        BigInteger c2 = ExpressionTools.getNumConst(f1);
        if (c1 != null && c2 != null && e2.equals(f2) &&
            c2.equals(c1.add(BigInteger.ONE))) {
            return ExpressionFactory.mkEq(e2,
                    ExpressionFactory.mkNumber(c2, e2.getType()));
        }
        // c2 <= x < c1 with c2 == c1 - 1
        c1 = ExpressionTools.getNumConst(e2);
        c2 = ExpressionTools.getNumConst(f2);
        if (c1 != null && c2 != null && e1.equals(f1) &&
            c2.equals(c1.subtract(BigInteger.ONE))) {
            return ExpressionFactory.mkEq(e1,
                    ExpressionFactory.mkNumber(c2, e1.getType()));
        }
        return null;
    }

    /**
     * Detects two strict bounds {@code lo < x && x < hi} with no integer in
     * between, i.e. {@code hi <= lo + 1}.
     *
     * @return the literal false, or null if the range is not provably empty.
     */
    public static Expression tryEmptyRange(Expression a, Expression b) {
        OrderRelation ra = OrderRelation.lessThan(a);
        OrderRelation rb = OrderRelation.lessThan(b);
        if (ra == null || rb == null) {
            return null;
        }
        if (isEmptyGap(ra, rb) || isEmptyGap(rb, ra)) {
            return ExpressionFactory.mkBool(false);
        }
        return null;
    }

    // lower.lhs < x && x < upper.rhs
    private static boolean isEmptyGap(OrderRelation lower,
            OrderRelation upper) {
        if (!lower.getRHS().equals(upper.getLHS())) {
            return false;
        }
        BigInteger lo = ExpressionTools.getNumConst(lower.getLHS());
        BigInteger hi = ExpressionTools.getNumConst(upper.getRHS());
        return lo != null && hi != null &&
                hi.compareTo(lo.add(BigInteger.ONE)) <= 0;
    }
}
