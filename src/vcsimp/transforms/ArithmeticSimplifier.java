package vcsimp.transforms;

import java.math.BigInteger;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;
import vcsimp.hir.Type;

/**
* Rules for comparisons and arithmetic operators. Identities that do not
* hold for checked machine arithmetic, such as {@code x + 1 - 1 == x} when
* the addition could abort, are only applied in spec mode.
*/
public class ArithmeticSimplifier {

    private final boolean spec_mode;

    public ArithmeticSimplifier(boolean spec_mode) {
        this.spec_mode = spec_mode;
    }

    public boolean isSpecMode() {
        return spec_mode;
    }

    /**
    * Simplifies a comparison over simplified operands: reflexive
    * comparisons, comparisons against the bounds of the other operand's
    * type and, in spec mode, comparisons of {@code e + c1} against a
    * constant.
    *
    * @return the replacement or null if no rule applies.
    */
    public Expression simplifyComparison(CallExpression call) {
        Operator op = call.getOperator();
        if (!op.isComparison()) {
            return null;
        }
        Expression a = call.getArgument(0);
        Expression b = call.getArgument(1);
        if (a.equals(b)) {
            boolean reflexive = (op == Operator.EQ || op == Operator.LE ||
                    op == Operator.GE);
            return ExpressionFactory.mkBool(reflexive);
        }
        Expression ret = simplifyByTypeBounds(op, a, b);
        if (ret == null && spec_mode) {
            ret = normalizeAddend(op, a, b);
        }
        return ret;
    }

    /**
    * Decides {@code a op b} when one side is a constant at or beyond the
    * bounds of the other side's bounded integer type. Both orientations are
    * tried.
    */
    protected Expression simplifyByTypeBounds(Operator op, Expression a,
            Expression b) {
        Boolean ret = null;
        BigInteger c = ExpressionTools.getNumConst(b);
        if (c != null) {
            ret = decideByBounds(op, a.getType(), c);
        }
        c = ExpressionTools.getNumConst(a);
        if (ret == null && c != null) {
            ret = decideByBounds(op.flip(), b.getType(), c);
        }
        return (ret == null) ? null : ExpressionFactory.mkBool(ret);
    }

    /**
    * Decides {@code e op val} for e of the given type.
    *
    * @return the truth value, or null if it depends on e.
    */
    private static Boolean decideByBounds(Operator op, Type type,
            BigInteger val) {
        if (!(type instanceof PrimitiveType)) {
            return null;
        }
        BigInteger max = ((PrimitiveType)type).getMaxValue();
        BigInteger min = ((PrimitiveType)type).getMinValue();
        if (max == null || min == null) {
            return null;
        }
        if (op == Operator.GT) {
            if (val.compareTo(max) >= 0) {
                return Boolean.FALSE;
            } else if (val.compareTo(min) < 0) {
                return Boolean.TRUE;
            }
        } else if (op == Operator.LT) {
            if (val.compareTo(min) <= 0) {
                return Boolean.FALSE;
            } else if (val.compareTo(max) > 0) {
                return Boolean.TRUE;
            }
        } else if (op == Operator.GE) {
            if (val.compareTo(max) > 0) {
                return Boolean.FALSE;
            } else if (val.compareTo(min) <= 0) {
                return Boolean.TRUE;
            }
        } else if (op == Operator.LE) {
            if (val.compareTo(min) < 0) {
                return Boolean.FALSE;
            } else if (val.compareTo(max) >= 0) {
                return Boolean.TRUE;
            }
        }
        return null;
    }

    /**
    * Moves a constant addend across a comparison with a constant:
    * {@code (e + c1) op c2} becomes {@code e op (c2 - c1)} and
    * {@code (e - c1) op c2} becomes {@code e op (c2 + c1)}. The result is
    * decided by the bounds of e's type if possible.
    */
    protected Expression normalizeAddend(Operator op, Expression a,
            Expression b) {
        Expression ret = normalizeAddendDirected(op, a, b);
        if (ret == null) {
            ret = normalizeAddendDirected(op.flip(), b, a);
        }
        return ret;
    }

    // sum op c2
    private Expression normalizeAddendDirected(Operator op, Expression sum,
            Expression constant) {
        BigInteger c2 = ExpressionTools.getNumConst(constant);
        if (c2 == null || !(sum instanceof CallExpression)) {
            return null;
        }
        CallExpression call = (CallExpression)sum;
        if (call.getArguments().size() != 2) {
            return null;
        }
        BigInteger c1 = ExpressionTools.getNumConst(call.getArgument(1));
        if (c1 == null) {
            return null;
        }
        BigInteger val;
        if (call.getOperator() == Operator.ADD) {
            val = c2.subtract(c1);
        } else if (call.getOperator() == Operator.SUB) {
            val = c2.add(c1);
        } else {
            return null;
        }
        Expression e = call.getArgument(0);
        Boolean decided = decideByBounds(op, e.getType(), val);
        if (decided != null) {
            return ExpressionFactory.mkBool(decided);
        }
        return ExpressionFactory.mkBoolCall(op, e,
                ExpressionFactory.mkNumber(val, e.getType()));
    }

    /**
    * Applies identities of binary arithmetic (spec mode only): neutral and
    * absorbing elements, {@code x - x}, and merging of the constants of
    * nested additions, subtractions and multiplications.
    *
    * @return the replacement or null if no rule applies.
    */
    public Expression simplifyArithmetic(CallExpression call) {
        if (!spec_mode || call.getArguments().size() != 2) {
            return null;
        }
        Operator op = call.getOperator();
        Type type = call.getType();
        Expression a = call.getArgument(0);
        Expression b = call.getArgument(1);
        if (op == Operator.ADD) {
            if (ExpressionTools.isNumConst(a, 0)) {
                return b;
            } else if (ExpressionTools.isNumConst(b, 0)) {
                return a;
            }
            BigInteger c2 = ExpressionTools.getNumConst(b);
            BigInteger c1 = getInnerConstant(a, Operator.ADD);
            if (c2 != null && c1 != null) {
                return mkOffset(inner(a), c1.add(c2), type);
            }
            c1 = getInnerConstant(a, Operator.SUB);
            if (c2 != null && c1 != null) {
                return mkOffset(inner(a), c2.subtract(c1), type);
            }
        } else if (op == Operator.SUB) {
            if (ExpressionTools.isNumConst(b, 0)) {
                return a;
            } else if (a.equals(b)) {
                return ExpressionFactory.mkNumber(0, type);
            }
            BigInteger c2 = ExpressionTools.getNumConst(b);
            BigInteger c1 = getInnerConstant(a, Operator.SUB);
            if (c2 != null && c1 != null) {
                return mkOffset(inner(a), c1.add(c2).negate(), type);
            }
            c1 = getInnerConstant(a, Operator.ADD);
            if (c2 != null && c1 != null) {
                return mkOffset(inner(a), c1.subtract(c2), type);
            }
        } else if (op == Operator.MUL) {
            if (ExpressionTools.isNumConst(a, 1)) {
                return b;
            } else if (ExpressionTools.isNumConst(b, 1)) {
                return a;
            } else if (ExpressionTools.isNumConst(a, 0) ||
                       ExpressionTools.isNumConst(b, 0)) {
                return ExpressionFactory.mkNumber(0, type);
            }
            BigInteger c2 = ExpressionTools.getNumConst(b);
            BigInteger c1 = getInnerConstant(a, Operator.MUL);
            if (c2 != null && c1 != null) {
                BigInteger product = c1.multiply(c2);
                if (product.signum() == 0) {
                    return ExpressionFactory.mkNumber(0, type);
                }
                return ExpressionFactory.mkCall(type, Operator.MUL, inner(a),
                        ExpressionFactory.mkNumber(product, type));
            }
        } else if (op == Operator.DIV) {
            if (ExpressionTools.isNumConst(b, 1)) {
                return a;
            }
        } else if (op == Operator.MOD) {
            if (ExpressionTools.isNumConst(b, 1)) {
                return ExpressionFactory.mkNumber(0, type);
            }
        }
        return null;
    }

    /** Returns c if e is {@code x op c} for a constant c. */
    private static BigInteger getInnerConstant(Expression e, Operator op) {
        if (!ExpressionTools.isCallOf(e, op)) {
            return null;
        }
        return ExpressionTools.getNumConst(((CallExpression)e).getArgument(1));
    }

    private static Expression inner(Expression e) {
        return ((CallExpression)e).getArgument(0);
    }

    // x + offset, written as a subtraction for negative offsets
    private static Expression mkOffset(Expression x, BigInteger offset,
            Type type) {
        int sign = offset.signum();
        if (sign == 0) {
            return x;
        } else if (sign > 0) {
            return ExpressionFactory.mkCall(type, Operator.ADD, x,
                    ExpressionFactory.mkNumber(offset, type));
        } else {
            return ExpressionFactory.mkCall(type, Operator.SUB, x,
                    ExpressionFactory.mkNumber(offset.negate(), type));
        }
    }
}
