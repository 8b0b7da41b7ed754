package vcsimp.hir;

import java.math.BigInteger;
import java.util.List;

/**
* Folds operator calls whose arguments are all literals. Arithmetic on a
* bounded type is folded only when the result stays inside the type range;
* an overflowing or underflowing operation aborts at run time and has to
* stay visible. Division and modulo by zero are never folded.
*/
public final class ConstantFolder {

    private ConstantFolder() {
    }

    /**
    * Tries to fold the given call.
    *
    * @param call the call to fold.
    * @return the literal result, or null if the call cannot be folded.
    */
    public static Literal fold(CallExpression call) {
        List<Expression> args = call.getArguments();
        if (args.isEmpty()) {
            return null;
        }
        for (Expression arg : args) {
            if (!(arg instanceof Literal)) {
                return null;
            }
        }
        Operator op = call.getOperator();
        if (op.isArithmetic()) {
            return foldArithmetic(op, args, call.getType());
        } else if (op.isComparison()) {
            return foldComparison(op, args);
        } else if (op.isLogical()) {
            return foldLogical(op, args);
        }
        return null;
    }

    private static Literal foldArithmetic(Operator op, List<Expression> args,
            Type type) {
        if (!(args.get(0) instanceof IntegerLiteral) ||
            !(args.get(1) instanceof IntegerLiteral)) {
            return null;
        }
        BigInteger v1 = ((IntegerLiteral)args.get(0)).getValue();
        BigInteger v2 = ((IntegerLiteral)args.get(1)).getValue();
        BigInteger result = null;
        if (op == Operator.ADD) {
            result = v1.add(v2);
        } else if (op == Operator.SUB) {
            result = v1.subtract(v2);
        } else if (op == Operator.MUL) {
            result = v1.multiply(v2);
        } else if (op == Operator.DIV) {
            if (v2.signum() == 0) {
                return null;
            }
            result = v1.divide(v2);
        } else if (op == Operator.MOD) {
            if (v2.signum() == 0) {
                return null;
            }
            result = v1.remainder(v2);
        }
        if (result == null || !fitsType(result, type)) {
            return null;
        }
        return new IntegerLiteral(result, type);
    }

    private static Literal foldComparison(Operator op,
            List<Expression> args) {
        Expression e1 = args.get(0), e2 = args.get(1);
        if (e1 instanceof BooleanLiteral && e2 instanceof BooleanLiteral) {
            boolean b1 = ((BooleanLiteral)e1).getValue();
            boolean b2 = ((BooleanLiteral)e2).getValue();
            if (op == Operator.EQ) {
                return BooleanLiteral.valueOf(b1 == b2);
            } else if (op == Operator.NEQ) {
                return BooleanLiteral.valueOf(b1 != b2);
            }
            return null;
        }
        if (!(e1 instanceof IntegerLiteral) ||
            !(e2 instanceof IntegerLiteral)) {
            return null;
        }
        int cmp = ((IntegerLiteral)e1).getValue().compareTo(
                ((IntegerLiteral)e2).getValue());
        boolean result;
        if (op == Operator.EQ) {
            result = (cmp == 0);
        } else if (op == Operator.NEQ) {
            result = (cmp != 0);
        } else if (op == Operator.LT) {
            result = (cmp < 0);
        } else if (op == Operator.LE) {
            result = (cmp <= 0);
        } else if (op == Operator.GT) {
            result = (cmp > 0);
        } else if (op == Operator.GE) {
            result = (cmp >= 0);
        } else {
            throw new InternalError("unknown comparison " + op);
        }
        return BooleanLiteral.valueOf(result);
    }

    private static Literal foldLogical(Operator op, List<Expression> args) {
        for (Expression arg : args) {
            if (!(arg instanceof BooleanLiteral)) {
                return null;
            }
        }
        boolean b1 = ((BooleanLiteral)args.get(0)).getValue();
        if (op == Operator.NOT) {
            return BooleanLiteral.valueOf(!b1);
        }
        boolean b2 = ((BooleanLiteral)args.get(1)).getValue();
        if (op == Operator.AND) {
            return BooleanLiteral.valueOf(b1 && b2);
        } else if (op == Operator.OR) {
            return BooleanLiteral.valueOf(b1 || b2);
        } else if (op == Operator.IMPLIES) {
            return BooleanLiteral.valueOf(!b1 || b2);
        } else if (op == Operator.IFF) {
            return BooleanLiteral.valueOf(b1 == b2);
        }
        throw new InternalError("unknown connective " + op);
    }

    /** Checks if the value lies in the range of a bounded integer type. */
    private static boolean fitsType(BigInteger value, Type type) {
        if (!(type instanceof PrimitiveType)) {
            return true;
        }
        PrimitiveType prim = (PrimitiveType)type;
        BigInteger max = prim.getMaxValue();
        BigInteger min = prim.getMinValue();
        return (max == null || value.compareTo(max) <= 0) &&
               (min == null || value.compareTo(min) >= 0);
    }

}
