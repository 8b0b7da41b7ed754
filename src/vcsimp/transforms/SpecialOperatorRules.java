package vcsimp.transforms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.Literal;
import vcsimp.hir.Operator;
import vcsimp.hir.SpecFunctionDecl;
import vcsimp.hir.SpecFunctionOperator;
import vcsimp.hir.StructOperator;
import vcsimp.hir.Symbol;

/**
* Rules for struct operations and the operators that only exist in
* verification conditions: MAX_U* constants, old, freeze, well_formed,
* abort_flag and calls of spec functions.
*/
public class SpecialOperatorRules {

    private final GlobalEnv env;

    private final boolean spec_mode;

    public SpecialOperatorRules(GlobalEnv env, boolean spec_mode) {
        this.env = env;
        this.spec_mode = spec_mode;
    }

    /**
    * Simplifies a call of a verification-only operator or a struct
    * operation. Spec function unfolding is handled by
    * {@link #unfoldSpecFunction} since it needs a recursive simplification.
    *
    * @return the replacement or null if no rule applies.
    */
    public Expression simplify(CallExpression call) {
        Operator op = call.getOperator();
        if (op.isMaxConstant()) {
            return ExpressionFactory.mkNumber(op.getMaxType().getMaxValue(),
                    call.getType());
        }
        if (op == Operator.OLD &&
            ExpressionTools.isCallOf(call.getArgument(0), Operator.OLD)) {
            return call.getArgument(0);
        }
        if (op == Operator.FREEZE && spec_mode) {
            return call.getArgument(0);
        }
        if (op instanceof StructOperator) {
            return simplifyStructOperation(call, (StructOperator)op);
        }
        if (op == Operator.WELL_FORMED) {
            return ExpressionFactory.mkBool(true);
        }
        if (op == Operator.ABORT_FLAG) {
            return ExpressionFactory.mkBool(false);
        }
        return null;
    }

    private Expression simplifyStructOperation(CallExpression call,
            StructOperator op) {
        if (op.isPack()) {
            return null;
        }
        Expression target = call.getArgument(0);
        if (!(target instanceof CallExpression) ||
            !(((CallExpression)target).getOperator() instanceof StructOperator)) {
            return null;
        }
        CallExpression inner = (CallExpression)target;
        StructOperator inner_op = (StructOperator)inner.getOperator();
        if (op.isUpdateField()) {
            if (inner_op.isUpdateField() && inner_op.sameField(op)) {
                // the later write wins
                return new CallExpression(op, call.getType(),
                        inner.getArgument(0), call.getArgument(1));
            }
            if (inner_op.isPack() && inner_op.sameStruct(op)) {
                int offset = getOffset(op);
                if (offset < inner.getArguments().size()) {
                    List<Expression> fields =
                            new ArrayList<Expression>(inner.getArguments());
                    fields.set(offset, call.getArgument(1));
                    return new CallExpression(inner_op, fields,
                            inner.getType());
                }
            }
        } else if (op.isSelect()) {
            if (inner_op.isUpdateField() && inner_op.sameField(op)) {
                return inner.getArgument(1);
            }
            if (inner_op.isPack() && inner_op.sameStruct(op)) {
                int offset = getOffset(op);
                if (offset < inner.getArguments().size()) {
                    return inner.getArgument(offset);
                }
            }
        }
        return null;
    }

    private int getOffset(StructOperator op) {
        return env.getFieldOffset(op.getStructName(), op.getFieldName());
    }

    /**
    * Returns the body of a called spec function with its parameters
    * replaced by the arguments, provided that all arguments are literals
    * and the function may be unfolded. The result is not simplified.
    *
    * @return the instantiated body, or null if the call is not unfolded.
    */
    public Expression unfoldSpecFunction(CallExpression call) {
        if (!(call.getOperator() instanceof SpecFunctionOperator)) {
            return null;
        }
        for (Expression arg : call.getArguments()) {
            if (!(arg instanceof Literal)) {
                return null;
            }
        }
        SpecFunctionDecl decl = env.getSpecFunction(
                ((SpecFunctionOperator)call.getOperator()).getFunctionName());
        if (!decl.isUnfoldable()) {
            return null;
        }
        Map<Symbol, Expression> map = new HashMap<Symbol, Expression>();
        List<Symbol> params = decl.getParameters();
        for (int i = 0; i < params.size() && i < call.getArguments().size();
                i++) {
            map.put(params.get(i), call.getArgument(i));
        }
        return ExpressionTools.substitute(decl.getBody(), map);
    }
}
