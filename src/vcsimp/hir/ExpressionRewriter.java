package vcsimp.hir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
* Generic bottom-up rewriter for expression trees. {@link #rewrite} visits
* the children of a node first and then offers the node, rebuilt over its
* rewritten children, to the callback of its kind. A callback returns the
* replacement or null to keep the node. Quantifiers announce their bound
* symbols through {@link #enterScope} and {@link #exitScope}; range domains
* are rewritten outside the new scope.
*
* Unchanged sub-trees are returned as the same instance, so a rewriter that
* never replaces anything costs one traversal and no allocation.
*/
public abstract class ExpressionRewriter {

    /** Constructor for derived classes. */
    protected ExpressionRewriter() {
    }

    /**
    * Rewrites the given expression. Subclasses that intercept particular
    * node kinds before their children are visited override this method and
    * call {@link #descend} for the default behavior.
    *
    * @param e the expression to rewrite.
    * @return the rewritten expression.
    */
    public Expression rewrite(Expression e) {
        return descend(e);
    }

    /**
    * Rewrites the children of the expression and then offers the node to
    * the callback of its kind.
    */
    protected Expression descend(Expression e) {
        Expression ret = null;
        if (e instanceof Literal) {
            ret = rewriteValue((Literal)e);
        } else if (e instanceof Identifier) {
            ret = rewriteLocalVar((Identifier)e);
        } else if (e instanceof Temporary) {
            ret = rewriteTemporary((Temporary)e);
        } else if (e instanceof CallExpression) {
            CallExpression call = (CallExpression)e;
            List<Expression> args = rewriteList(call.getArguments());
            if (args != null) {
                call = new CallExpression(call.getOperator(), args,
                        call.getType());
            }
            ret = rewriteCall(call);
            if (ret == null) {
                ret = call;
            }
            return ret;
        } else if (e instanceof ConditionalExpression) {
            ConditionalExpression ce = (ConditionalExpression)e;
            List<Expression> children = rewriteList(ce.getChildren());
            if (children != null) {
                ce = new ConditionalExpression(children.get(0),
                        children.get(1), children.get(2));
            }
            ret = rewriteIfElse(ce);
            if (ret == null) {
                ret = ce;
            }
            return ret;
        } else if (e instanceof QuantifierExpression) {
            QuantifierExpression q = descendQuantifier((QuantifierExpression)e);
            ret = rewriteQuantifier(q);
            if (ret == null) {
                ret = q;
            }
            return ret;
        } else {
            throw new InternalError("unknown expression kind " +
                    e.getClass().getName());
        }
        return (ret == null) ? e : ret;
    }

    private QuantifierExpression descendQuantifier(QuantifierExpression q) {
        boolean changed = false;
        List<QuantifierRange> ranges =
                new ArrayList<QuantifierRange>(q.getRanges().size());
        for (QuantifierRange range : q.getRanges()) {
            Expression domain = rewrite(range.getDomain());
            if (domain != range.getDomain()) {
                changed = true;
                range = range.withDomain(domain);
            }
            ranges.add(range);
        }
        List<List<Expression>> triggers = new ArrayList<List<Expression>>();
        Expression cond = q.getCondition();
        Expression body;
        enterScope(new LinkedHashSet<Symbol>(q.getSymbols()));
        try {
            for (List<Expression> group : q.getTriggers()) {
                List<Expression> new_group = rewriteList(group);
                if (new_group != null) {
                    changed = true;
                    triggers.add(new_group);
                } else {
                    triggers.add(group);
                }
            }
            if (cond != null) {
                Expression new_cond = rewrite(cond);
                changed |= (new_cond != cond);
                cond = new_cond;
            }
            body = rewrite(q.getBody());
            changed |= (body != q.getBody());
        } finally {
            exitScope();
        }
        if (!changed) {
            return q;
        }
        return new QuantifierExpression(q.getKind(), ranges, triggers, cond,
                body);
    }

    /**
    * Rewrites every expression of the list.
    *
    * @return the new list, or null if no element changed.
    */
    protected List<Expression> rewriteList(List<Expression> list) {
        List<Expression> ret = null;
        for (int i = 0; i < list.size(); i++) {
            Expression old_e = list.get(i);
            Expression new_e = rewrite(old_e);
            if (new_e != old_e && ret == null) {
                ret = new ArrayList<Expression>(list.subList(0, i));
            }
            if (ret != null) {
                ret.add(new_e);
            }
        }
        return ret;
    }

    /** Notifies that the given symbols are bound from now on. */
    protected void enterScope(Set<Symbol> symbols) {
    }

    /** Notifies that the innermost scope has been left. */
    protected void exitScope() {
    }

    /** Callback for literals. */
    protected Expression rewriteValue(Literal value) {
        return null;
    }

    /** Callback for local variable references. */
    protected Expression rewriteLocalVar(Identifier id) {
        return null;
    }

    /** Callback for temporary references. */
    protected Expression rewriteTemporary(Temporary temp) {
        return null;
    }

    /** Callback for calls, given over the rewritten arguments. */
    protected Expression rewriteCall(CallExpression call) {
        return null;
    }

    /** Callback for conditionals, given over the rewritten branches. */
    protected Expression rewriteIfElse(ConditionalExpression ce) {
        return null;
    }

    /** Callback for quantifiers, given over the rewritten children. */
    protected Expression rewriteQuantifier(QuantifierExpression q) {
        return null;
    }

}
