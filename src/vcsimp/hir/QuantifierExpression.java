package vcsimp.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* A universally or existentially quantified expression. The bound symbols
* come from an ordered list of ranges; trigger groups and an optional filter
* condition are carried along for the prover. Children are laid out as
* range domains, trigger expressions, condition (if any) and body.
*/
public class QuantifierExpression extends Expression {

    /** Kinds of quantifiers. */
    public static enum Kind {FORALL, EXISTS}

    private final Kind kind;

    private final List<QuantifierRange> ranges;

    private final List<List<Expression>> triggers;

    private final boolean has_condition;

    /**
    * Constructs a quantifier.
    *
    * @param kind forall or exists.
    * @param ranges the binders, at least one.
    * @param triggers trigger groups, possibly empty.
    * @param condition the filter condition or null.
    * @param body the quantified body.
    * @throws IllegalArgumentException if there is no range.
    */
    public QuantifierExpression(Kind kind, List<QuantifierRange> ranges,
            List<List<Expression>> triggers, Expression condition,
            Expression body) {
        super(PrimitiveType.BOOL,
                layoutChildren(ranges, triggers, condition, body));
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("quantifier without ranges");
        }
        this.kind = kind;
        this.ranges = Collections.unmodifiableList(
                new ArrayList<QuantifierRange>(ranges));
        List<List<Expression>> tcopy =
                new ArrayList<List<Expression>>(triggers.size());
        for (List<Expression> group : triggers) {
            tcopy.add(Collections.unmodifiableList(
                    new ArrayList<Expression>(group)));
        }
        this.triggers = Collections.unmodifiableList(tcopy);
        this.has_condition = (condition != null);
    }

    /** Constructs a quantifier without triggers and condition. */
    public QuantifierExpression(Kind kind, List<QuantifierRange> ranges,
            Expression body) {
        this(kind, ranges, Collections.<List<Expression>>emptyList(), null,
                body);
    }

    private static List<Expression> layoutChildren(
            List<QuantifierRange> ranges, List<List<Expression>> triggers,
            Expression condition, Expression body) {
        List<Expression> ret = new ArrayList<Expression>();
        for (QuantifierRange range : ranges) {
            ret.add(range.getDomain());
        }
        for (List<Expression> group : triggers) {
            ret.addAll(group);
        }
        if (condition != null) {
            ret.add(condition);
        }
        ret.add(body);
        return ret;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isForall() {
        return kind == Kind.FORALL;
    }

    public boolean isExists() {
        return kind == Kind.EXISTS;
    }

    public List<QuantifierRange> getRanges() {
        return ranges;
    }

    /** Returns the bound symbols in range order. */
    public List<Symbol> getSymbols() {
        List<Symbol> ret = new ArrayList<Symbol>(ranges.size());
        for (QuantifierRange range : ranges) {
            ret.add(range.getSymbol());
        }
        return ret;
    }

    public List<List<Expression>> getTriggers() {
        return triggers;
    }

    /** Returns the filter condition, or null if there is none. */
    public Expression getCondition() {
        return has_condition ? children.get(children.size() - 2) : null;
    }

    public Expression getBody() {
        return children.get(children.size() - 1);
    }

    /**
    * Checks if the quantifier is plain: no triggers and no condition. Only
    * plain quantifiers are merged with their neighbours.
    */
    public boolean isPlain() {
        return triggers.isEmpty() && !has_condition;
    }

    public void print(PrintWriter o) {
        o.print(kind == Kind.FORALL ? "(forall " : "(exists ");
        o.print(PrintTools.listToString(ranges, ", "));
        for (List<Expression> group : triggers) {
            o.print(" {");
            PrintTools.printListWithComma(group, o);
            o.print("}");
        }
        if (has_condition) {
            o.print(" where ");
            getCondition().print(o);
        }
        o.print(": ");
        getBody().print(o);
        o.print(")");
    }

    @Override
    protected boolean equalsNode(Expression other) {
        QuantifierExpression q = (QuantifierExpression)other;
        if (kind != q.kind || has_condition != q.has_condition ||
            ranges.size() != q.ranges.size() ||
            triggers.size() != q.triggers.size()) {
            return false;
        }
        for (int i = 0; i < ranges.size(); i++) {
            if (!ranges.get(i).getSymbol().equals(
                    q.ranges.get(i).getSymbol())) {
                return false;
            }
        }
        for (int i = 0; i < triggers.size(); i++) {
            if (triggers.get(i).size() != q.triggers.get(i).size()) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected int hashNode() {
        int h = kind.ordinal();
        for (QuantifierRange range : ranges) {
            h = 31 * h + range.getSymbol().hashCode();
        }
        return h;
    }

}
