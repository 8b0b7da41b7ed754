package vcsimp.transforms;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import vcsimp.analysis.ComparisonReasoner;
import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.FieldDecl;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.Identifier;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;
import vcsimp.hir.PrintTools;
import vcsimp.hir.QuantifierExpression;
import vcsimp.hir.QuantifierRange;
import vcsimp.hir.StructDecl;
import vcsimp.hir.StructOperator;
import vcsimp.hir.Symbol;
import vcsimp.hir.Type;

/**
* Eliminates bound variables of forall and exists expressions. The
* simplifier is invoked on a quantifier whose children are already
* simplified and proceeds in fixed steps:
* <ol>
* <li>flattening of a directly nested quantifier of the same kind;</li>
* <li>(exists) absorption of plain exists conjuncts;</li>
* <li>one-point elimination of variables bound by an equality, interleaved
*     with merging of antisymmetric bounds into equalities;</li>
* <li>elimination of struct variables whose fields are all bound;</li>
* <li>removal of unused variables;</li>
* <li>(forall) dropping variables that only occur in the antecedent;</li>
* <li>(exists) splitting into independent components;</li>
* <li>(exists) substitution of upper-bound witnesses for monotone bodies;</li>
* <li>(exists) trial instantiation with the smallest and largest value.</li>
* </ol>
* Every rewritten body is simplified again through the owning
* {@link ExpSimplifier}, so the assumptions in scope take part.
*/
public class QuantifierSimplifier {

    private static final String tag = "[Quantifier]";

    private final ExpSimplifier owner;

    private final GlobalEnv env;

    /** A variable bound to a value, and the body left after removing the binding. */
    private static class Binding {

        private final Symbol symbol;

        private final Expression value;

        private final Expression body;

        private Binding(Symbol symbol, Expression value, Expression body) {
            this.symbol = symbol;
            this.value = value;
            this.body = body;
        }
    }

    public QuantifierSimplifier(ExpSimplifier owner, GlobalEnv env) {
        this.owner = owner;
        this.env = env;
    }

    /**
    * Simplifies a quantifier.
    *
    * @param q the quantifier over simplified children.
    * @return the replacement, or null if the quantifier carries a filter
    *   condition and is left alone.
    */
    public Expression simplify(QuantifierExpression q) {
        if (q.getCondition() != null) {
            return null;
        }
        return q.isForall() ? simplifyForall(q) : simplifyExists(q);
    }

    /////////////////////////////////////////////////////////////////////////
    // forall
    /////////////////////////////////////////////////////////////////////////

    protected Expression simplifyForall(QuantifierExpression q) {
        List<QuantifierRange> ranges = new ArrayList<QuantifierRange>(q.getRanges());
        Expression body = flattenNested(QuantifierExpression.Kind.FORALL,
                ranges, q.getBody());

        boolean changed = true;
        while (changed) {
            changed = false;
            Binding binding = extractForallBinding(ranges, body);
            if (binding != null && removeRange(ranges, binding.symbol)) {
                PrintTools.printlnStatus(2, tag, "one-point", binding.symbol,
                        ":=", binding.value);
                body = resimplify(ranges, ExpressionTools.substitute(binding.body,
                        binding.symbol, binding.value));
                changed = true;
                continue;
            }
            if (ExpressionTools.isCallOf(body, Operator.IMPLIES)) {
                CallExpression imp = (CallExpression)body;
                List<Expression> parts =
                        ExpressionTools.flattenConjunction(imp.getArgument(0));
                if (normalizeAntisymmetricConjuncts(parts)) {
                    body = BooleanSimplifier.mkImplies(
                            BooleanSimplifier.mkAndAll(parts),
                            imp.getArgument(1));
                    changed = true;
                }
            }
        }

        changed = true;
        while (changed) {
            changed = false;
            if (!ExpressionTools.isCallOf(body, Operator.IMPLIES)) {
                break;
            }
            CallExpression imp = (CallExpression)body;
            List<Expression> conjuncts =
                    ExpressionTools.flattenConjunction(imp.getArgument(0));
            Binding binding = findStructFieldBinding(ranges, conjuncts);
            if (binding != null && removeRange(ranges, binding.symbol)) {
                PrintTools.printlnStatus(2, tag, "struct one-point",
                        binding.symbol, ":=", binding.value);
                Expression rest = mkImplies(conjuncts, imp.getArgument(1));
                body = resimplify(ranges, ExpressionTools.substitute(rest,
                        binding.symbol, binding.value));
                changed = true;
            }
        }

        removeUnusedRanges(ranges, body);

        if (!ranges.isEmpty() && ExpressionTools.isCallOf(body, Operator.IMPLIES)) {
            CallExpression imp = (CallExpression)body;
            Expression consequent = imp.getArgument(1);
            List<Expression> conjuncts =
                    ExpressionTools.flattenConjunction(imp.getArgument(0));
            Set<Symbol> antecedent_only = getAntecedentOnlySymbols(ranges,
                    conjuncts, consequent);
            if (!antecedent_only.isEmpty()) {
                PrintTools.printlnStatus(2, tag, "antecedent-only",
                        antecedent_only);
                Iterator<QuantifierRange> iter = ranges.iterator();
                while (iter.hasNext()) {
                    if (antecedent_only.contains(iter.next().getSymbol())) {
                        iter.remove();
                    }
                }
                if (ranges.isEmpty()) {
                    return consequent;
                }
                Set<Symbol> remaining = getSymbols(ranges);
                List<Expression> kept = new ArrayList<Expression>();
                for (Expression conj : conjuncts) {
                    if (!Collections.disjoint(
                            ExpressionTools.getFreeVariables(conj), remaining)) {
                        kept.add(conj);
                    }
                }
                body = mkImplies(kept, consequent);
            }
        }

        if (ranges.isEmpty()) {
            return body;
        }
        return rebuild(q, ranges, body);
    }

    /**
    * Finds the variables bound by the quantifier that occur in the
    * antecedent conjuncts but not in the consequent. A variable sharing a
    * conjunct with a variable of the consequent is not included.
    */
    private static Set<Symbol> getAntecedentOnlySymbols(
            List<QuantifierRange> ranges, List<Expression> conjuncts,
            Expression consequent) {
        Set<Symbol> in_consequent = ExpressionTools.getFreeVariables(consequent);
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        Set<Symbol> remaining = new LinkedHashSet<Symbol>();
        for (Symbol sym : getSymbols(ranges)) {
            if (in_consequent.contains(sym)) {
                remaining.add(sym);
            } else {
                ret.add(sym);
            }
        }
        for (Expression conj : conjuncts) {
            Set<Symbol> free = ExpressionTools.getFreeVariables(conj);
            if (!Collections.disjoint(free, remaining)) {
                ret.removeAll(free);
            }
        }
        return ret;
    }

    /**
    * Finds a binding {@code v == e} of a bound variable in the antecedent of
    * {@code A ==> Q}: either the whole antecedent, or one of at least two
    * conjuncts, in which case the others stay in the antecedent.
    */
    private Binding extractForallBinding(List<QuantifierRange> ranges,
            Expression body) {
        if (!ExpressionTools.isCallOf(body, Operator.IMPLIES)) {
            return null;
        }
        Expression antecedent = ((CallExpression)body).getArgument(0);
        Expression consequent = ((CallExpression)body).getArgument(1);
        Set<Symbol> bound = getSymbols(ranges);
        Binding ret = extractBinding(antecedent, bound, consequent);
        if (ret != null) {
            return ret;
        }
        List<Expression> conjuncts = ExpressionTools.flattenConjunction(antecedent);
        if (conjuncts.size() < 2) {
            return null;
        }
        for (int i = 0; i < conjuncts.size(); i++) {
            ret = extractBinding(conjuncts.get(i), bound, null);
            if (ret != null) {
                List<Expression> rest = new ArrayList<Expression>(conjuncts);
                rest.remove(i);
                return new Binding(ret.symbol, ret.value,
                        mkImplies(rest, consequent));
            }
        }
        return null;
    }

    /////////////////////////////////////////////////////////////////////////
    // exists
    /////////////////////////////////////////////////////////////////////////

    protected Expression simplifyExists(QuantifierExpression q) {
        List<QuantifierRange> ranges = new ArrayList<QuantifierRange>(q.getRanges());
        Expression body = flattenNested(QuantifierExpression.Kind.EXISTS,
                ranges, q.getBody());
        body = absorbExistsConjuncts(ranges, body);

        boolean changed = true;
        while (changed) {
            changed = false;
            Binding binding = extractExistsBinding(ranges, body);
            if (binding != null && removeRange(ranges, binding.symbol)) {
                PrintTools.printlnStatus(2, tag, "one-point", binding.symbol,
                        ":=", binding.value);
                body = resimplify(ranges, ExpressionTools.substitute(binding.body,
                        binding.symbol, binding.value));
                changed = true;
                continue;
            }
            List<Expression> parts = ExpressionTools.flattenConjunction(body);
            if (normalizeAntisymmetricConjuncts(parts)) {
                body = BooleanSimplifier.mkAndAll(parts);
                changed = true;
            }
        }

        changed = true;
        while (changed) {
            changed = false;
            List<Expression> conjuncts = ExpressionTools.flattenConjunction(body);
            Binding binding = findStructFieldBinding(ranges, conjuncts);
            if (binding != null && removeRange(ranges, binding.symbol)) {
                PrintTools.printlnStatus(2, tag, "struct one-point",
                        binding.symbol, ":=", binding.value);
                body = resimplify(ranges, ExpressionTools.substitute(
                        BooleanSimplifier.mkAndAll(conjuncts), binding.symbol,
                        binding.value));
                changed = true;
            }
        }

        removeUnusedRanges(ranges, body);

        if (!ranges.isEmpty()) {
            Expression split = trySplit(ranges, body);
            if (split != null) {
                return split;
            }
        }

        if (ranges.isEmpty()) {
            return body;
        }

        Expression ret = tryUpperBoundWitness(ranges, body);
        if (ret != null) {
            return ret;
        }
        if (isTriviallySatisfiable(ranges, body)) {
            PrintTools.printlnStatus(2, tag, "witness instantiation succeeded");
            return ExpressionFactory.mkBool(true);
        }
        return rebuild(q, ranges, body);
    }

    /**
    * Merges plain exists conjuncts of the body into the outer quantifier:
    * {@code exists x: A(x) && (exists y: B(x, y))} becomes
    * {@code exists x, y: A(x) && B(x, y)}.
    */
    private Expression absorbExistsConjuncts(List<QuantifierRange> ranges,
            Expression body) {
        List<Expression> conjuncts = ExpressionTools.flattenConjunction(body);
        if (conjuncts.size() < 2) {
            return body;
        }
        boolean absorbed = false;
        List<Expression> new_conjuncts = new ArrayList<Expression>();
        for (Expression conj : conjuncts) {
            if (conj instanceof QuantifierExpression) {
                QuantifierExpression inner = (QuantifierExpression)conj;
                if (inner.isExists() && inner.isPlain()) {
                    addRanges(ranges, inner.getRanges());
                    new_conjuncts.addAll(
                            ExpressionTools.flattenConjunction(inner.getBody()));
                    absorbed = true;
                    continue;
                }
            }
            new_conjuncts.add(conj);
        }
        return absorbed ? BooleanSimplifier.mkAndAll(new_conjuncts) : body;
    }

    private Binding extractExistsBinding(List<QuantifierRange> ranges,
            Expression body) {
        Set<Symbol> bound = getSymbols(ranges);
        List<Expression> conjuncts = ExpressionTools.flattenConjunction(body);
        for (int i = 0; i < conjuncts.size(); i++) {
            Binding binding = extractBinding(conjuncts.get(i), bound, null);
            if (binding != null) {
                List<Expression> rest = new ArrayList<Expression>(conjuncts);
                rest.remove(i);
                return new Binding(binding.symbol, binding.value,
                        BooleanSimplifier.mkAndAll(rest));
            }
        }
        return null;
    }

    /**
    * Splits {@code exists xs: C1 && ... && Cn} into conjuncts free of the
    * bound variables and one exists per group of variables connected by
    * shared conjuncts.
    *
    * @return the conjunction of the parts, or null if there is only one
    *   group and no variable-free conjunct.
    */
    private Expression trySplit(List<QuantifierRange> ranges, Expression body) {
        List<Symbol> symbols = new ArrayList<Symbol>(getSymbols(ranges));
        List<Expression> conjuncts = ExpressionTools.flattenConjunction(body);
        if (conjuncts.size() < 2) {
            return null;
        }
        List<Set<Symbol>> conj_vars = new ArrayList<Set<Symbol>>();
        boolean has_independent = false;
        int[] parent = new int[symbols.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (Expression conj : conjuncts) {
            Set<Symbol> vars = ExpressionTools.getFreeVariables(conj);
            vars.retainAll(symbols);
            conj_vars.add(vars);
            has_independent |= vars.isEmpty();
            int first = -1;
            for (Symbol sym : vars) {
                int index = symbols.indexOf(sym);
                if (first < 0) {
                    first = index;
                } else {
                    union(parent, first, index);
                }
            }
        }
        Set<Integer> roots = new TreeSet<Integer>();
        for (int i = 0; i < parent.length; i++) {
            roots.add(find(parent, i));
        }
        if (roots.size() < 2 && !has_independent) {
            return null;
        }
        PrintTools.printlnStatus(2, tag, "split into", roots.size(),
                "components");
        List<Expression> parts = new ArrayList<Expression>();
        for (int i = 0; i < conjuncts.size(); i++) {
            if (conj_vars.get(i).isEmpty()) {
                parts.add(conjuncts.get(i));
            }
        }
        for (int root : roots) {
            Set<Symbol> component = new LinkedHashSet<Symbol>();
            for (int i = 0; i < symbols.size(); i++) {
                if (find(parent, i) == root) {
                    component.add(symbols.get(i));
                }
            }
            List<QuantifierRange> comp_ranges = new ArrayList<QuantifierRange>();
            for (QuantifierRange range : ranges) {
                if (component.contains(range.getSymbol())) {
                    comp_ranges.add(range);
                }
            }
            List<Expression> comp_body = new ArrayList<Expression>();
            for (int i = 0; i < conjuncts.size(); i++) {
                if (!Collections.disjoint(conj_vars.get(i), component)) {
                    comp_body.add(conjuncts.get(i));
                }
            }
            if (comp_ranges.isEmpty() || comp_body.isEmpty()) {
                continue;
            }
            parts.add(resimplify(ranges, ExpressionFactory.mkExists(comp_ranges,
                    BooleanSimplifier.mkAndAll(comp_body))));
        }
        if (parts.isEmpty()) {
            return null;
        }
        return BooleanSimplifier.mkAndAll(parts);
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[rb] = ra;
        }
    }

    /**
    * For unsigned variables bounded from above by {@code x <= e} (or
    * {@code x < e}) with e free of all bound variables, substitutes the
    * bound (or {@code e - 1} under the guard {@code e > 0}) when every other
    * conjunct stays true as the variables grow.
    *
    * @return the simplified instantiation, or null if the rule does not
    *   apply.
    */
    private Expression tryUpperBoundWitness(List<QuantifierRange> ranges,
            Expression body) {
        for (QuantifierRange range : ranges) {
            if (!range.getType().isUnsignedInt()) {
                return null;
            }
        }
        Set<Symbol> bound = getSymbols(ranges);
        List<Expression> conjuncts = ExpressionTools.flattenConjunction(body);
        Map<Symbol, Expression> witnesses = new LinkedHashMap<Symbol, Expression>();
        List<Expression> guards = new ArrayList<Expression>();
        List<Expression> remaining = new ArrayList<Expression>();
        for (Expression conj : conjuncts) {
            if (!recordUpperBound(conj, bound, witnesses, guards)) {
                remaining.add(conj);
            }
        }
        if (witnesses.size() != bound.size()) {
            return null;
        }
        if (remaining.isEmpty()) {
            if (guards.isEmpty()) {
                return null;
            }
            return resimplify(ranges, BooleanSimplifier.mkAndAll(guards));
        }
        for (Expression conj : remaining) {
            for (Symbol sym : bound) {
                if (!isUpwardSafe(conj, sym, true)) {
                    return null;
                }
            }
        }
        PrintTools.printlnStatus(2, tag, "upper-bound witness", witnesses);
        Expression ret = ExpressionTools.substitute(
                BooleanSimplifier.mkAndAll(remaining), witnesses);
        for (Expression guard : guards) {
            ret = BooleanSimplifier.mkAnd(guard, ret);
        }
        return resimplify(ranges, ret);
    }

    /**
    * Records the witness of a conjunct {@code x <= e} or {@code x < e} for
    * a bound variable that has none yet.
    *
    * @return true if the conjunct was consumed as a bound.
    */
    private static boolean recordUpperBound(Expression conj, Set<Symbol> bound,
            Map<Symbol, Expression> witnesses, List<Expression> guards) {
        boolean strict = ExpressionTools.isCallOf(conj, Operator.LT);
        if (!strict && !ExpressionTools.isCallOf(conj, Operator.LE)) {
            return false;
        }
        CallExpression call = (CallExpression)conj;
        if (!(call.getArgument(0) instanceof Identifier)) {
            return false;
        }
        Symbol sym = ((Identifier)call.getArgument(0)).getSymbol();
        Expression limit = call.getArgument(1);
        if (!bound.contains(sym) || witnesses.containsKey(sym) ||
            !Collections.disjoint(ExpressionTools.getFreeVariables(limit), bound)) {
            return false;
        }
        if (strict) {
            Type type = limit.getType();
            witnesses.put(sym, ExpressionFactory.mkCall(type, Operator.SUB,
                    limit, ExpressionFactory.mkNumber(1, type)));
            guards.add(ExpressionFactory.mkGt(limit,
                    ExpressionFactory.mkNumber(0, type)));
        } else {
            witnesses.put(sym, limit);
        }
        return true;
    }

    /**
    * Checks if a conjunct that holds for some value of {@code sym} also
    * holds for every larger value: it does not mention sym, or it is
    * {@code f > c} or {@code f >= c} with c free of sym and f monotone
    * increasing in sym.
    */
    static boolean isUpwardSafe(Expression conj, Symbol sym,
            boolean unsigned_context) {
        if (!ExpressionTools.isFreeIn(sym, conj)) {
            return true;
        }
        if (ExpressionTools.isCallOf(conj, Operator.GT) ||
            ExpressionTools.isCallOf(conj, Operator.GE)) {
            CallExpression call = (CallExpression)conj;
            return !ExpressionTools.isFreeIn(sym, call.getArgument(1)) &&
                    isMonotoneIncreasing(call.getArgument(0), sym,
                    unsigned_context);
        }
        return false;
    }

    /**
    * Checks if the expression grows with sym. Products count only when
    * their operands are non-negative, i.e. the product type is unsigned or
    * all bound variables are unsigned.
    */
    static boolean isMonotoneIncreasing(Expression e, Symbol sym,
            boolean unsigned_context) {
        if (!ExpressionTools.isFreeIn(sym, e)) {
            return true;
        }
        if (ExpressionTools.isLocalVar(e, sym)) {
            return true;
        }
        if (!(e instanceof CallExpression)) {
            return false;
        }
        CallExpression call = (CallExpression)e;
        Operator op = call.getOperator();
        if (op == Operator.ADD) {
            return isMonotoneIncreasing(call.getArgument(0), sym, unsigned_context)
                    && isMonotoneIncreasing(call.getArgument(1), sym,
                    unsigned_context);
        } else if (op == Operator.MUL) {
            return (call.getType().isUnsignedInt() || unsigned_context) &&
                    isMonotoneIncreasing(call.getArgument(0), sym,
                    unsigned_context) &&
                    isMonotoneIncreasing(call.getArgument(1), sym,
                    unsigned_context);
        } else if (op == Operator.DIV) {
            BigInteger c = ExpressionTools.getNumConst(call.getArgument(1));
            return c != null && c.signum() > 0 &&
                    isMonotoneIncreasing(call.getArgument(0), sym,
                    unsigned_context);
        }
        return false;
    }

    /**
    * Tries the witnesses 0/false and then max/true for all bound variables
    * at once.
    */
    private boolean isTriviallySatisfiable(List<QuantifierRange> ranges,
            Expression body) {
        Map<Symbol, Expression> low = new LinkedHashMap<Symbol, Expression>();
        for (QuantifierRange range : ranges) {
            Type type = range.getType();
            if (type.isUnsignedInt()) {
                low.put(range.getSymbol(), ExpressionFactory.mkNumber(0, type));
            } else if (type.isBool()) {
                low.put(range.getSymbol(), ExpressionFactory.mkBool(false));
            } else {
                return false;
            }
        }
        if (ExpressionTools.isBoolConst(
                resimplify(ranges, ExpressionTools.substitute(body, low)), true)) {
            return true;
        }
        Map<Symbol, Expression> high = new LinkedHashMap<Symbol, Expression>();
        for (QuantifierRange range : ranges) {
            Type type = range.getType();
            if (type.isBool()) {
                high.put(range.getSymbol(), ExpressionFactory.mkBool(true));
            } else if (type instanceof PrimitiveType &&
                       ((PrimitiveType)type).getMaxValue() != null) {
                high.put(range.getSymbol(), ExpressionFactory.mkNumber(
                        ((PrimitiveType)type).getMaxValue(), type));
            } else {
                return false;
            }
        }
        return ExpressionTools.isBoolConst(
                resimplify(ranges, ExpressionTools.substitute(body, high)), true);
    }

    /////////////////////////////////////////////////////////////////////////
    // shared steps
    /////////////////////////////////////////////////////////////////////////

    /**
    * Simplifies a rewritten body with the variables still in {@code ranges}
    * bound, nested ranges merged by flattening included.
    */
    private Expression resimplify(List<QuantifierRange> ranges, Expression e) {
        return owner.simplifyBound(getSymbols(ranges), e);
    }

    /**
    * Merges a directly nested plain quantifier of the same kind into the
    * given ranges.
    *
    * @return the body of the nested quantifier, or the body itself.
    */
    private static Expression flattenNested(QuantifierExpression.Kind kind,
            List<QuantifierRange> ranges, Expression body) {
        if (body instanceof QuantifierExpression) {
            QuantifierExpression inner = (QuantifierExpression)body;
            if (inner.getKind() == kind && inner.isPlain()) {
                addRanges(ranges, inner.getRanges());
                return inner.getBody();
            }
        }
        return body;
    }

    private static void addRanges(List<QuantifierRange> ranges,
            List<QuantifierRange> added) {
        Set<Symbol> existing = getSymbols(ranges);
        for (QuantifierRange range : added) {
            if (!existing.contains(range.getSymbol())) {
                ranges.add(range);
            }
        }
    }

    /**
    * Checks if {@code e} is {@code v == x} or {@code x == v} for a bound
    * variable v not free in x.
    *
    * @param rest the body to attach to the binding.
    */
    private static Binding extractBinding(Expression e, Set<Symbol> bound,
            Expression rest) {
        if (!ExpressionTools.isCallOf(e, Operator.EQ)) {
            return null;
        }
        CallExpression eq = (CallExpression)e;
        for (int i = 0; i < 2; i++) {
            Expression var = eq.getArgument(i);
            Expression value = eq.getArgument(1 - i);
            if (var instanceof Identifier) {
                Symbol sym = ((Identifier)var).getSymbol();
                if (bound.contains(sym) && !ExpressionTools.isFreeIn(sym, value)) {
                    return new Binding(sym, value, rest);
                }
            }
        }
        return null;
    }

    /**
    * Finds a bound variable of a struct type without variants whose fields
    * are each bound by a conjunct {@code x.f == e} with x not free in e. The
    * binding conjuncts are removed from the list and the returned binding
    * maps the variable to the packed field values.
    */
    private Binding findStructFieldBinding(List<QuantifierRange> ranges,
            List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            return null;
        }
        for (QuantifierRange range : ranges) {
            StructDecl decl = env.getStruct(range.getType());
            if (decl == null || decl.hasVariants() || decl.getFields().isEmpty()) {
                continue;
            }
            Symbol sym = range.getSymbol();
            List<Expression> values = new ArrayList<Expression>();
            Set<Integer> used = new TreeSet<Integer>();
            for (FieldDecl field : decl.getFields()) {
                int index = findFieldBinding(decl, field, sym, conjuncts, values);
                if (index < 0) {
                    break;
                }
                used.add(index);
            }
            if (values.size() != decl.getFields().size()) {
                continue;
            }
            List<Expression> rest = new ArrayList<Expression>();
            for (int i = 0; i < conjuncts.size(); i++) {
                if (!used.contains(i)) {
                    rest.add(conjuncts.get(i));
                }
            }
            conjuncts.clear();
            conjuncts.addAll(rest);
            return new Binding(sym, ExpressionFactory.mkPack(decl, values), null);
        }
        return null;
    }

    // Appends the bound value to values and returns the conjunct index, or -1.
    private static int findFieldBinding(StructDecl decl, FieldDecl field,
            Symbol sym, List<Expression> conjuncts, List<Expression> values) {
        for (int i = 0; i < conjuncts.size(); i++) {
            if (!ExpressionTools.isCallOf(conjuncts.get(i), Operator.EQ)) {
                continue;
            }
            CallExpression eq = (CallExpression)conjuncts.get(i);
            for (int j = 0; j < 2; j++) {
                Expression value = eq.getArgument(1 - j);
                if (isFieldSelect(eq.getArgument(j), decl, field, sym) &&
                    !ExpressionTools.isFreeIn(sym, value)) {
                    values.add(value);
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isFieldSelect(Expression e, StructDecl decl,
            FieldDecl field, Symbol sym) {
        if (!(e instanceof CallExpression)) {
            return false;
        }
        CallExpression call = (CallExpression)e;
        if (!(call.getOperator() instanceof StructOperator)) {
            return false;
        }
        StructOperator op = (StructOperator)call.getOperator();
        return op.isSelect() && op.getStructName().equals(decl.getName()) &&
                op.getFieldName().equals(field.getName()) &&
                ExpressionTools.isLocalVar(call.getArgument(0), sym);
    }

    /**
    * Removes duplicate conjuncts and replaces pairs {@code a <= b},
    * {@code b <= a} by {@code a == b}.
    *
    * @param parts the conjuncts, modified in place.
    * @return true if the list changed.
    */
    public static boolean normalizeAntisymmetricConjuncts(List<Expression> parts) {
        boolean found = false;
        for (int i = 0; i < parts.size(); i++) {
            int j = i + 1;
            while (j < parts.size()) {
                Expression eq;
                if (parts.get(i).equals(parts.get(j))) {
                    parts.remove(j);
                    found = true;
                } else if ((eq = ComparisonReasoner.tryAntisymmetryToEq(
                        parts.get(i), parts.get(j))) != null) {
                    parts.set(i, eq);
                    parts.remove(j);
                    found = true;
                } else {
                    j++;
                }
            }
        }
        return found;
    }

    private static Expression mkImplies(List<Expression> antecedent,
            Expression consequent) {
        if (antecedent.isEmpty()) {
            return consequent;
        }
        return BooleanSimplifier.mkImplies(
                BooleanSimplifier.mkAndAll(antecedent), consequent);
    }

    private static boolean removeRange(List<QuantifierRange> ranges, Symbol sym) {
        Iterator<QuantifierRange> iter = ranges.iterator();
        while (iter.hasNext()) {
            if (iter.next().getSymbol().equals(sym)) {
                iter.remove();
                return true;
            }
        }
        return false;
    }

    private static void removeUnusedRanges(List<QuantifierRange> ranges,
            Expression body) {
        Set<Symbol> free = ExpressionTools.getFreeVariables(body);
        Iterator<QuantifierRange> iter = ranges.iterator();
        while (iter.hasNext()) {
            if (!free.contains(iter.next().getSymbol())) {
                iter.remove();
            }
        }
    }

    private static Set<Symbol> getSymbols(List<QuantifierRange> ranges) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (QuantifierRange range : ranges) {
            ret.add(range.getSymbol());
        }
        return ret;
    }

    /**
    * Rebuilds the quantifier over the surviving ranges. Trigger groups that
    * mention an eliminated variable are dropped.
    */
    private static Expression rebuild(QuantifierExpression q,
            List<QuantifierRange> ranges, Expression body) {
        Set<Symbol> eliminated = new LinkedHashSet<Symbol>(q.getSymbols());
        eliminated.removeAll(getSymbols(ranges));
        List<List<Expression>> triggers = new ArrayList<List<Expression>>();
        for (List<Expression> group : q.getTriggers()) {
            boolean dangling = false;
            for (Expression e : group) {
                if (!Collections.disjoint(ExpressionTools.getFreeVariables(e),
                        eliminated)) {
                    dangling = true;
                }
            }
            if (!dangling) {
                triggers.add(group);
            }
        }
        return ExpressionFactory.mkQuantifier(q.getKind(), ranges, triggers,
                q.getCondition(), body);
    }
}
