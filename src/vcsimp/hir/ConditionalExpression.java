package vcsimp.hir;

import java.io.PrintWriter;
import java.util.Arrays;

/** if/then/else over expressions. */
public class ConditionalExpression extends Expression {

    public ConditionalExpression(Expression condition, Expression true_expr,
            Expression false_expr) {
        super(true_expr.getType(),
                Arrays.asList(condition, true_expr, false_expr));
    }

    public Expression getCondition() {
        return children.get(0);
    }

    public Expression getTrueExpression() {
        return children.get(1);
    }

    public Expression getFalseExpression() {
        return children.get(2);
    }

    public void print(PrintWriter o) {
        o.print("(if ");
        getCondition().print(o);
        o.print(" then ");
        getTrueExpression().print(o);
        o.print(" else ");
        getFalseExpression().print(o);
        o.print(")");
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return true;
    }

    @Override
    protected int hashNode() {
        return 0;
    }

}
