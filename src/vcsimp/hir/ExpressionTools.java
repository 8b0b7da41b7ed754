package vcsimp.hir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* <b>ExpressionTools</b> provides queries and structural transformations on
* expression trees that respect variable binding.
*/
public final class ExpressionTools {

    private ExpressionTools() {
    }

    /**
    * Returns the local variables that occur free in the expression, i.e.
    * outside the scope of a quantifier binding the same symbol.
    *
    * @param e the expression to inspect.
    * @return the free symbols in order of first occurrence.
    */
    public static Set<Symbol> getFreeVariables(Expression e) {
        FreeVariableCollector collector = new FreeVariableCollector();
        collector.rewrite(e);
        return collector.free;
    }

    /** Checks if the symbol occurs free in the expression. */
    public static boolean isFreeIn(Symbol sym, Expression e) {
        return getFreeVariables(e).contains(sym);
    }

    /**
    * Replaces every free occurrence of a local variable by an expression.
    * Occurrences under a quantifier that rebinds the symbol are kept.
    *
    * @param e the expression to transform.
    * @param sym the variable to replace.
    * @param replacement the replacing expression.
    * @return the transformed expression.
    */
    public static Expression substitute(Expression e, Symbol sym,
            Expression replacement) {
        return substitute(e, Collections.singletonMap(sym, replacement));
    }

    /**
    * Replaces free occurrences of several local variables at once.
    *
    * @param e the expression to transform.
    * @param map the replacement of each variable.
    * @return the transformed expression.
    */
    public static Expression substitute(Expression e,
            Map<Symbol, Expression> map) {
        if (map.isEmpty()) {
            return e;
        }
        return new Substituter(map).rewrite(e);
    }

    /**
    * Flattens nested conjunctions into a list of conjuncts.
    * {@code a && (b && c)} becomes {@code [a, b, c]}; anything that is not a
    * conjunction becomes a singleton list.
    */
    public static List<Expression> flattenConjunction(Expression e) {
        List<Expression> ret = new ArrayList<Expression>();
        flattenConjunction(e, ret);
        return ret;
    }

    private static void flattenConjunction(Expression e,
            List<Expression> ret) {
        if (isCallOf(e, Operator.AND)) {
            flattenConjunction(((CallExpression)e).getArgument(0), ret);
            flattenConjunction(((CallExpression)e).getArgument(1), ret);
        } else {
            ret.add(e);
        }
    }

    /** Returns the number of nodes in the tree. */
    public static int getNodeCount(Expression e) {
        int count = 0;
        DepthFirstIterator<Expression> iter =
                new DepthFirstIterator<Expression>(e);
        while (iter.hasNext()) {
            iter.next();
            count++;
        }
        return count;
    }

    /** Checks if the expression is a call of the given operator. */
    public static boolean isCallOf(Expression e, Operator op) {
        return (e instanceof CallExpression &&
                ((CallExpression)e).getOperator().equals(op));
    }

    /** Checks if the expression is the boolean literal {@code val}. */
    public static boolean isBoolConst(Expression e, boolean val) {
        return (e instanceof BooleanLiteral &&
                ((BooleanLiteral)e).getValue() == val);
    }

    /** Checks if the expression is the integer literal {@code val}. */
    public static boolean isNumConst(Expression e, long val) {
        return (e instanceof IntegerLiteral && ((IntegerLiteral)e).isValue(val));
    }

    /**
    * Returns the value of an integer literal.
    *
    * @return the value, or null if the expression is not an integer literal.
    */
    public static BigInteger getNumConst(Expression e) {
        return (e instanceof IntegerLiteral) ?
                ((IntegerLiteral)e).getValue() : null;
    }

    /** Checks if the expression is a reference to the given symbol. */
    public static boolean isLocalVar(Expression e, Symbol sym) {
        return (e instanceof Identifier &&
                ((Identifier)e).getSymbol().equals(sym));
    }

    /** Tracks binders while walking a tree. */
    private abstract static class ScopedRewriter extends ExpressionRewriter {

        protected final List<Set<Symbol>> scopes =
                new ArrayList<Set<Symbol>>();

        @Override
        protected void enterScope(Set<Symbol> symbols) {
            scopes.add(symbols);
        }

        @Override
        protected void exitScope() {
            scopes.remove(scopes.size() - 1);
        }

        protected boolean isBound(Symbol sym) {
            for (int i = 0; i < scopes.size(); i++) {
                if (scopes.get(i).contains(sym)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static class FreeVariableCollector extends ScopedRewriter {

        private final Set<Symbol> free = new LinkedHashSet<Symbol>();

        @Override
        protected Expression rewriteLocalVar(Identifier id) {
            if (!isBound(id.getSymbol())) {
                free.add(id.getSymbol());
            }
            return null;
        }
    }

    private static class Substituter extends ScopedRewriter {

        private final Map<Symbol, Expression> map;

        private Substituter(Map<Symbol, Expression> map) {
            this.map = new HashMap<Symbol, Expression>(map);
        }

        @Override
        protected Expression rewriteLocalVar(Identifier id) {
            if (isBound(id.getSymbol())) {
                return null;
            }
            return map.get(id.getSymbol());
        }
    }

}
