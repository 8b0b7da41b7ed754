package vcsimp.transforms;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import vcsimp.analysis.AssumptionTracker;
import vcsimp.analysis.ComparisonReasoner;
import vcsimp.exec.Driver;
import vcsimp.hir.CallExpression;
import vcsimp.hir.ConditionalExpression;
import vcsimp.hir.ConstantFolder;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionRewriter;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.Identifier;
import vcsimp.hir.Literal;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;
import vcsimp.hir.PrintTools;
import vcsimp.hir.QuantifierExpression;
import vcsimp.hir.QuantifierRange;
import vcsimp.hir.RewriteTarget;
import vcsimp.hir.Symbol;
import vcsimp.hir.Temporary;

/**
* <b>ExpSimplifier</b> rewrites verification conditions bottom-up into
* smaller equivalent expressions under a set of known-true assumptions.
* <p>
* Each node is rebuilt over its simplified children and then offered, in
* order, to constant folding, the special-operator rules, the boolean rules,
* the comparison and arithmetic rules, the struct rules and spec function
* unfolding. Quantifiers go to the {@link QuantifierSimplifier}. Finally
* every node that is known true or known false under the assumptions is
* replaced by the literal.
* <p>
* The antecedent of an implication is assumed while its consequent is
* simplified, and the assumption state is restored afterwards, so
* {@code 3 < n ==> (2 < n ==> P)} becomes {@code 3 < n ==> P}. Assumed
* equalities of temporaries and local variables are substituted, except
* inside {@code old(...)} and for variables rebound by a quantifier. Facts
* that mention a variable rebound by a quantifier are withdrawn while its
* ranges, triggers and body are simplified.
* <p>
* An instance is not thread-safe; use one per obligation.
*/
public class ExpSimplifier extends ExpressionRewriter {

    private static final String tag = "[ExpSimplifier]";

    private final GlobalEnv env;

    private final boolean spec_mode;

    private final AssumptionTracker tracker;

    /** Symbols bound by the enclosing quantifiers, innermost last */
    private final List<Set<Symbol>> shadowed;

    /** Tracker states saved on entry of each scope in shadowed */
    private final List<AssumptionTracker.Snapshot> scope_states;

    private final ArithmeticSimplifier arith;

    private final SpecialOperatorRules special;

    private final QuantifierSimplifier quantifiers;

    private final int max_unfold_depth;

    private final boolean skip_quantifiers;

    private boolean inside_old;

    private int unfold_depth;

    /**
    * Creates a simplifier in spec mode.
    *
    * @param env the declarations of structs and spec functions.
    */
    public ExpSimplifier(GlobalEnv env) {
        this(env, true);
    }

    /**
    * Creates a simplifier.
    *
    * @param env the declarations of structs and spec functions.
    * @param spec_mode true for unbounded spec arithmetic, false for checked
    *   program arithmetic where identities like {@code x + 0 == x} are not
    *   applied.
    */
    public ExpSimplifier(GlobalEnv env, boolean spec_mode) {
        this.env = env;
        this.spec_mode = spec_mode;
        tracker = new AssumptionTracker();
        shadowed = new ArrayList<Set<Symbol>>();
        scope_states = new ArrayList<AssumptionTracker.Snapshot>();
        arith = new ArithmeticSimplifier(spec_mode);
        special = new SpecialOperatorRules(env, spec_mode);
        quantifiers = new QuantifierSimplifier(this, env);
        max_unfold_depth = Driver.getIntOption("max-unfold-depth", 10);
        skip_quantifiers = Driver.isOptionSet("skip-quantifiers");
        inside_old = false;
        unfold_depth = 0;
    }

    public GlobalEnv getEnv() {
        return env;
    }

    public boolean isSpecMode() {
        return spec_mode;
    }

    /**
    * Registers a known-true fact for all later simplifications.
    *
    * @param e the fact, assumed to be simplified already.
    */
    public void assume(Expression e) {
        tracker.assume(e);
    }

    /**
    * Returns the simplified form of the expression. The assumptions are
    * unchanged when the method returns.
    */
    public Expression simplify(Expression e) {
        PrintTools.printlnStatus(3, tag, "simplify", e);
        Expression ret = rewrite(e);
        PrintTools.printlnStatus(3, tag, "result", ret);
        return ret;
    }

    /**
    * Simplifies an expression in which the given variables are bound by a
    * quantifier being rewritten. Outer facts about variables of the same
    * name are withdrawn meanwhile.
    */
    Expression simplifyBound(Set<Symbol> bound, Expression e) {
        enterScope(bound);
        try {
            return simplify(e);
        } finally {
            exitScope();
        }
    }

    public boolean isKnownTrue(Expression e) {
        return tracker.isKnownTrue(e);
    }

    public boolean isKnownFalse(Expression e) {
        return tracker.isKnownFalse(e);
    }

    /**
    * Checks if {@code b} implies {@code a}, making b redundant as a disjunct
    * next to a.
    */
    public boolean subsumes(Expression a, Expression b) {
        return ComparisonReasoner.subsumes(a, b);
    }

    /**
    * Checks if a forall is false because its body simplifies to false with
    * every bound variable set to 0.
    */
    public boolean isForallProvablyFalse(Expression e) {
        if (!(e instanceof QuantifierExpression) ||
            !((QuantifierExpression)e).isForall()) {
            return false;
        }
        QuantifierExpression q = (QuantifierExpression)e;
        Expression body = q.getBody();
        for (QuantifierRange range : q.getRanges()) {
            body = ExpressionTools.substitute(body, range.getSymbol(),
                    ExpressionFactory.mkNumber(BigInteger.ZERO,
                    PrimitiveType.U64));
        }
        return ExpressionTools.isBoolConst(simplify(body), false);
    }

    /////////////////////////////////////////////////////////////////////////
    // rewriter callbacks
    /////////////////////////////////////////////////////////////////////////

    @Override
    public Expression rewrite(Expression e) {
        if (ExpressionTools.isCallOf(e, Operator.IMPLIES)) {
            return rewriteImplication((CallExpression)e);
        }
        Expression ret;
        if (ExpressionTools.isCallOf(e, Operator.OLD)) {
            boolean was_inside_old = inside_old;
            inside_old = true;
            try {
                ret = descend(e);
            } finally {
                inside_old = was_inside_old;
            }
        } else {
            ret = descend(e);
        }
        return simplifyByAssumption(ret);
    }

    private Expression rewriteImplication(CallExpression imp) {
        Expression antecedent = rewrite(imp.getArgument(0));
        Expression consequent;
        AssumptionTracker.Snapshot snapshot = tracker.snapshot();
        try {
            tracker.assume(antecedent);
            consequent = rewrite(imp.getArgument(1));
        } finally {
            tracker.restore(snapshot);
        }
        return simplifyByAssumption(
                BooleanSimplifier.mkImplies(antecedent, consequent));
    }

    private Expression simplifyByAssumption(Expression e) {
        if (e instanceof Literal) {
            return e;
        }
        if (tracker.isKnownTrue(e)) {
            return ExpressionFactory.mkBool(true);
        } else if (tracker.isKnownFalse(e)) {
            return ExpressionFactory.mkBool(false);
        }
        return e;
    }

    @Override
    protected void enterScope(Set<Symbol> symbols) {
        shadowed.add(symbols);
        scope_states.add(tracker.hide(symbols));
    }

    @Override
    protected void exitScope() {
        shadowed.remove(shadowed.size() - 1);
        tracker.restore(scope_states.remove(scope_states.size() - 1));
    }

    private boolean isShadowed(Symbol sym) {
        for (Set<Symbol> scope : shadowed) {
            if (scope.contains(sym)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected Expression rewriteLocalVar(Identifier id) {
        if (inside_old || isShadowed(id.getSymbol())) {
            return null;
        }
        return tracker.lookup(RewriteTarget.forLocal(id.getSymbol()));
    }

    @Override
    protected Expression rewriteTemporary(Temporary temp) {
        if (inside_old) {
            return null;
        }
        return tracker.lookup(RewriteTarget.forTemporary(temp.getIndex()));
    }

    @Override
    protected Expression rewriteCall(CallExpression call) {
        Expression ret = ConstantFolder.fold(call);
        if (ret != null) {
            return ret;
        }
        Operator op = call.getOperator();
        if (op.isMaxConstant() || op == Operator.OLD || op == Operator.FREEZE) {
            ret = special.simplify(call);
            if (ret != null) {
                return ret;
            }
        }
        if (op.isLogical()) {
            Expression[] args = call.getArguments().toArray(
                    new Expression[call.getArguments().size()]);
            return BooleanSimplifier.simplify(op, args);
        }
        if (op.isComparison()) {
            ret = arith.simplifyComparison(call);
            if (ret != null) {
                return ret;
            }
        }
        if (op.isArithmetic()) {
            ret = arith.simplifyArithmetic(call);
            if (ret != null) {
                return ret;
            }
        }
        ret = special.simplify(call);
        if (ret != null) {
            return ret;
        }
        if (unfold_depth < max_unfold_depth) {
            Expression unfolded = special.unfoldSpecFunction(call);
            if (unfolded != null) {
                PrintTools.printlnStatus(4, tag, "unfold", call);
                unfold_depth++;
                try {
                    return rewrite(unfolded);
                } finally {
                    unfold_depth--;
                }
            }
        }
        return null;
    }

    @Override
    protected Expression rewriteIfElse(ConditionalExpression ce) {
        Expression cond = ce.getCondition();
        Expression then_e = ce.getTrueExpression();
        Expression else_e = ce.getFalseExpression();
        if (tracker.isKnownTrue(cond)) {
            return then_e;
        } else if (tracker.isKnownFalse(cond)) {
            return else_e;
        } else if (then_e.equals(else_e)) {
            return then_e;
        } else if (ExpressionTools.isBoolConst(then_e, true) &&
                   ExpressionTools.isBoolConst(else_e, false)) {
            return cond;
        } else if (ExpressionTools.isBoolConst(then_e, false) &&
                   ExpressionTools.isBoolConst(else_e, true)) {
            return BooleanSimplifier.mkNot(cond);
        }
        return null;
    }

    /**
    * Offers the quantifier to the quantifier simplifier. Its variables stay
    * shadowed meanwhile, so the re-simplification of the body does not
    * substitute them.
    */
    @Override
    protected Expression rewriteQuantifier(QuantifierExpression q) {
        if (skip_quantifiers) {
            return null;
        }
        enterScope(new LinkedHashSet<Symbol>(q.getSymbols()));
        try {
            return quantifiers.simplify(q);
        } finally {
            exitScope();
        }
    }
}
