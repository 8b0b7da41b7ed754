package vcsimp.hir;

import java.io.PrintWriter;

/** Call of a spec function declared in the {@link GlobalEnv}. */
public final class SpecFunctionOperator extends Operator {

    private final String function_name;

    public SpecFunctionOperator(String function_name) {
        super(SPEC_FUN_CODE, false);
        if (function_name == null) {
            throw new IllegalArgumentException("spec function without a name");
        }
        this.function_name = function_name;
    }

    public String getFunctionName() {
        return function_name;
    }

    @Override
    public void print(PrintWriter o) {
        o.print(function_name);
    }

    @Override
    public String toString() {
        return function_name;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof SpecFunctionOperator &&
                function_name.equals(((SpecFunctionOperator)o).function_name));
    }

    @Override
    public int hashCode() {
        return function_name.hashCode();
    }

}
