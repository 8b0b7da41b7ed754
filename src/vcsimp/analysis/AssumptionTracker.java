package vcsimp.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.Identifier;
import vcsimp.hir.Operator;
import vcsimp.hir.PrintTools;
import vcsimp.hir.RewriteTarget;
import vcsimp.hir.Symbol;
import vcsimp.hir.Temporary;

/**
 * Keeps the facts known to hold at the current point of a simplification:
 * an ordered list of assumptions without structural duplicates, and a map
 * from temporaries and local variables to the expressions they are known to
 * equal. Queries decide whether an expression is known to be true or false
 * from these facts, directly, through comparison implication, or through
 * the axioms of a total order.
 */
public class AssumptionTracker {

    private static final String tag = "[ExpSimplifier]";

    private final List<Expression> assumptions;

    private final Map<RewriteTarget, Expression> substitutions;

    /**
     * Saved state of a tracker. Restoring it truncates the assumption list to
     * the saved length, or puts back the full list saved by
     * {@link #hide(Set)}, and replaces the substitution map with the saved
     * copy.
     */
    public static class Snapshot {

        private final int num_assumptions;

        /** Full assumption list, only kept by hide() */
        private final List<Expression> assumptions;

        private final Map<RewriteTarget, Expression> substitutions;

        private Snapshot(int num_assumptions, List<Expression> assumptions,
                Map<RewriteTarget, Expression> substitutions) {
            this.num_assumptions = num_assumptions;
            this.assumptions = assumptions;
            this.substitutions = substitutions;
        }
    }

    public AssumptionTracker() {
        assumptions = new ArrayList<Expression>();
        substitutions = new HashMap<RewriteTarget, Expression>();
    }

    /**
     * Registers a known-true fact. Conjunctions are split into their
     * conjuncts. An equality with a temporary or local variable on one side
     * records a substitution for it; the other side is first resolved
     * against the existing substitutions, so {@code x == y} after
     * {@code y == 5} binds x to 5. A later binding of the same slot replaces
     * the earlier one.
     *
     * @param e the fact.
     */
    public void assume(Expression e) {
        if (ExpressionTools.isCallOf(e, Operator.AND)) {
            assume(((CallExpression)e).getArgument(0));
            assume(((CallExpression)e).getArgument(1));
            return;
        }
        if (ExpressionTools.isCallOf(e, Operator.EQ)) {
            recordSubstitution((CallExpression)e);
        }
        if (!assumptions.contains(e)) {
            PrintTools.printlnStatus(4, tag, "assume", e);
            assumptions.add(e);
        }
    }

    private void recordSubstitution(CallExpression eq) {
        Expression lhs = eq.getArgument(0);
        Expression rhs = eq.getArgument(1);
        RewriteTarget target;
        Expression value;
        if (lhs instanceof Temporary) {
            target = RewriteTarget.of(lhs);
            value = rhs;
        } else if (rhs instanceof Temporary) {
            target = RewriteTarget.of(rhs);
            value = lhs;
        } else if (lhs instanceof Identifier) {
            target = RewriteTarget.of(lhs);
            value = rhs;
        } else if (rhs instanceof Identifier) {
            target = RewriteTarget.of(rhs);
            value = lhs;
        } else {
            return;
        }
        value = applySubstitutions(value);
        PrintTools.printlnStatus(4, tag, "substitute", target, "->", value);
        substitutions.put(target, value);
    }

    /**
     * Returns the binding of a bare temporary or local variable reference,
     * or the expression itself when there is none. Composite expressions are
     * returned unchanged.
     */
    public Expression applySubstitutions(Expression e) {
        Expression ret = lookup(RewriteTarget.of(e));
        return (ret == null) ? e : ret;
    }

    /**
     * Returns the binding of a slot.
     *
     * @param target the slot, may be null.
     * @return the bound expression, or null if the slot is not bound.
     */
    public Expression lookup(RewriteTarget target) {
        return (target == null) ? null : substitutions.get(target);
    }

    /** Returns the current assumptions in insertion order. */
    public List<Expression> getAssumptions() {
        return Collections.unmodifiableList(assumptions);
    }

    /** Checks if the exact expression has been assumed. */
    public boolean isAssumed(Expression e) {
        return assumptions.contains(e);
    }

    /** Saves the current state. */
    public Snapshot snapshot() {
        return new Snapshot(assumptions.size(), null,
                new HashMap<RewriteTarget, Expression>(substitutions));
    }

    /**
     * Withdraws the facts that mention any of the given variables until the
     * returned state is restored. Used when the variables are rebound by a
     * quantifier: a fact about the outer variable says nothing about the
     * bound one. Substitutions of the variables and substitutions whose value
     * mentions them are withdrawn as well.
     *
     * @param symbols the variables being rebound.
     * @return the state before the withdrawal.
     */
    public Snapshot hide(Set<Symbol> symbols) {
        Snapshot ret = new Snapshot(assumptions.size(),
                new ArrayList<Expression>(assumptions),
                new HashMap<RewriteTarget, Expression>(substitutions));
        Iterator<Expression> iter = assumptions.iterator();
        while (iter.hasNext()) {
            if (mentions(iter.next(), symbols)) {
                iter.remove();
            }
        }
        Iterator<Map.Entry<RewriteTarget, Expression>> entries =
                substitutions.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<RewriteTarget, Expression> entry = entries.next();
            RewriteTarget target = entry.getKey();
            if ((target.isLocal() && symbols.contains(target.getSymbol())) ||
                mentions(entry.getValue(), symbols)) {
                entries.remove();
            }
        }
        return ret;
    }

    private static boolean mentions(Expression e, Set<Symbol> symbols) {
        return !Collections.disjoint(ExpressionTools.getFreeVariables(e),
                symbols);
    }

    /** Restores a state saved by {@link #snapshot()} or {@link #hide(Set)}. */
    public void restore(Snapshot snapshot) {
        if (snapshot.assumptions != null) {
            assumptions.clear();
            assumptions.addAll(snapshot.assumptions);
        } else if (snapshot.num_assumptions > assumptions.size()) {
            throw new InternalError("snapshot is newer than the tracker");
        } else {
            assumptions.subList(snapshot.num_assumptions,
                    assumptions.size()).clear();
        }
        substitutions.clear();
        substitutions.putAll(snapshot.substitutions);
    }

    /**
     * Checks if {@code e} is the literal true, is implied by an assumption,
     * or follows from the ordering facts among the assumptions.
     */
    public boolean isKnownTrue(Expression e) {
        if (ExpressionTools.isBoolConst(e, true)) {
            return true;
        }
        for (Expression asn : assumptions) {
            if (asn.equals(e) || ComparisonReasoner.impliesComparison(asn, e)) {
                return true;
            }
        }
        return isKnownTrueByOrdering(e);
    }

    /**
     * Checks if {@code e} is the literal false, is contradicted by an
     * assumption, or is refuted by the ordering facts among the assumptions.
     */
    public boolean isKnownFalse(Expression e) {
        if (ExpressionTools.isBoolConst(e, false)) {
            return true;
        }
        for (Expression asn : assumptions) {
            if (ComparisonReasoner.isComplementary(asn, e) ||
                ComparisonReasoner.impliesComplementary(asn, e)) {
                return true;
            }
        }
        return isKnownFalseByOrdering(e);
    }

    /** Checks if {@code a < b} follows from a single assumption. */
    public boolean isOrderingKnownLt(Expression a, Expression b) {
        Expression lt = ExpressionFactory.mkLt(a, b);
        for (Expression asn : assumptions) {
            if (asn.equals(lt) || ComparisonReasoner.impliesComparison(asn, lt)) {
                return true;
            }
            if (isBinaryCall(asn, Operator.GT, b, a)) {
                return true;
            }
        }
        return false;
    }

    /** Checks if {@code !(a < b)} follows from a single assumption. */
    public boolean isOrderingKnownNotLt(Expression a, Expression b) {
        Expression lt = ExpressionFactory.mkLt(a, b);
        for (Expression asn : assumptions) {
            if (ComparisonReasoner.isComplementary(asn, lt) ||
                ComparisonReasoner.impliesComplementary(asn, lt)) {
                return true;
            }
            if (isBinaryCall(asn, Operator.GE, a, b) ||
                isBinaryCall(asn, Operator.LE, b, a)) {
                return true;
            }
            if (ExpressionTools.isCallOf(asn, Operator.NOT) &&
                isBinaryCall(((CallExpression)asn).getArgument(0),
                        Operator.GT, b, a)) {
                return true;
            }
        }
        return false;
    }

    // Strict less-than is left out to avoid recursion through isKnownTrue.
    private boolean isKnownTrueByOrdering(Expression e) {
        if (!(e instanceof CallExpression) ||
            ((CallExpression)e).getArguments().size() != 2) {
            return false;
        }
        CallExpression call = (CallExpression)e;
        Expression a = call.getArgument(0);
        Expression b = call.getArgument(1);
        Operator op = call.getOperator();
        if (op == Operator.LE) {
            return isOrderingKnownNotLt(b, a);
        } else if (op == Operator.GE) {
            return isOrderingKnownNotLt(a, b);
        } else if (op == Operator.GT) {
            return isOrderingKnownLt(b, a);
        } else if (op == Operator.EQ) {
            return isOrderingKnownNotLt(a, b) && isOrderingKnownNotLt(b, a);
        }
        return false;
    }

    private boolean isKnownFalseByOrdering(Expression e) {
        if (!(e instanceof CallExpression) ||
            ((CallExpression)e).getArguments().size() != 2) {
            return false;
        }
        CallExpression call = (CallExpression)e;
        Expression a = call.getArgument(0);
        Expression b = call.getArgument(1);
        Operator op = call.getOperator();
        if (op == Operator.LE) {
            return isOrderingKnownLt(b, a);
        } else if (op == Operator.GE) {
            return isOrderingKnownLt(a, b);
        } else if (op == Operator.GT) {
            return isOrderingKnownNotLt(b, a);
        } else if (op == Operator.EQ) {
            return isOrderingKnownLt(a, b) || isOrderingKnownLt(b, a);
        } else if (op == Operator.NEQ) {
            return isOrderingKnownNotLt(a, b) && isOrderingKnownNotLt(b, a);
        }
        return false;
    }

    private static boolean isBinaryCall(Expression e, Operator op,
            Expression a, Expression b) {
        if (!ExpressionTools.isCallOf(e, op)) {
            return false;
        }
        CallExpression call = (CallExpression)e;
        return call.getArgument(0).equals(a) && call.getArgument(1).equals(b);
    }
}
