package vcsimp.hir;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;

/**
* Application of an {@link Operator} to a list of argument expressions. This
* one node kind covers arithmetic, comparisons, boolean connectives, struct
* operations, spec function calls and the verification-only operators.
*/
public class CallExpression extends Expression {

    private final Operator op;

    /**
    * Constructs a call of the given operator.
    *
    * @param op the operator.
    * @param args the arguments.
    * @param type the result type.
    * @throws IllegalArgumentException if the number of arguments does not
    *   match a fixed-arity operator.
    */
    public CallExpression(Operator op, List<Expression> args, Type type) {
        super(type, args);
        if (op == null) {
            throw new IllegalArgumentException("call without an operator");
        }
        int arity = getArity(op);
        if (arity >= 0 && arity != args.size()) {
            throw new IllegalArgumentException("operator " + op + " expects " +
                    arity + " arguments but got " + args.size());
        }
        this.op = op;
    }

    public CallExpression(Operator op, Type type, Expression... args) {
        this(op, Arrays.asList(args), type);
    }

    /**
    * Returns the number of arguments a fixed-arity operator takes, or -1 for
    * operators with a variable argument list (pack, spec functions).
    */
    public static int getArity(Operator op) {
        if (op instanceof StructOperator) {
            StructOperator sop = (StructOperator)op;
            if (sop.isPack()) {
                return -1;
            }
            return sop.isSelect() ? 1 : 2;
        }
        if (op instanceof SpecFunctionOperator) {
            return -1;
        }
        if (op.isInfix()) {
            return 2;
        }
        if (op == Operator.NOT || op == Operator.OLD ||
            op == Operator.FREEZE || op == Operator.WELL_FORMED) {
            return 1;
        }
        return 0;
    }

    public Operator getOperator() {
        return op;
    }

    /** Returns the arguments of the call. */
    public List<Expression> getArguments() {
        return children;
    }

    /** Returns the argument at the given position. */
    public Expression getArgument(int i) {
        return children.get(i);
    }

    /** Checks if this call applies the given operator. */
    public boolean isCallOf(Operator o) {
        return op.equals(o);
    }

    public void print(PrintWriter o) {
        if (op.isInfix()) {
            o.print("(");
            children.get(0).print(o);
            o.print(" ");
            op.print(o);
            o.print(" ");
            children.get(1).print(o);
            o.print(")");
        } else if (op == Operator.NOT) {
            o.print("!");
            children.get(0).print(o);
        } else {
            op.print(o);
            o.print("(");
            PrintTools.printListWithComma(children, o);
            o.print(")");
        }
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return op.equals(((CallExpression)other).op);
    }

    @Override
    protected int hashNode() {
        return op.hashCode();
    }

}
