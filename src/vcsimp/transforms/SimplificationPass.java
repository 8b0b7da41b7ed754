package vcsimp.transforms;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import vcsimp.exec.Driver;
import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionTools;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.PrintTools;

/**
* Simplifies a batch of named verification conditions that share a list of
* context assumptions. Every condition gets a fresh {@link ExpSimplifier}
* with the context assumed, so assumptions never flow from one condition
* into another. The arithmetic mode comes from the {@code spec-mode}
* option.
*/
public class SimplificationPass extends TransformPass {

    private static final String pass_name = "[SimplificationPass]";

    /** A named proof obligation. */
    public static class VerificationCondition {

        private final String name;

        private final Expression condition;

        public VerificationCondition(String name, Expression condition) {
            if (name == null || condition == null) {
                throw new IllegalArgumentException(
                        "verification condition needs a name and an expression");
            }
            this.name = name;
            this.condition = condition;
        }

        public String getName() {
            return name;
        }

        public Expression getCondition() {
            return condition;
        }

        @Override
        public String toString() {
            return name + ": " + condition;
        }
    }

    private final List<Expression> context;

    private final List<VerificationCondition> conditions;

    private final Map<String, Expression> results;

    private int num_discharged;

    private int num_refuted;

    public SimplificationPass(GlobalEnv env, List<Expression> context,
            List<VerificationCondition> conditions) {
        super(env);
        this.context = new ArrayList<Expression>(context);
        this.conditions = new ArrayList<VerificationCondition>(conditions);
        results = new LinkedHashMap<String, Expression>();
    }

    @Override
    public String getPassName() {
        return pass_name;
    }

    @Override
    public void start() {
        boolean spec_mode = Driver.isOptionSet("spec-mode");
        results.clear();
        num_discharged = 0;
        num_refuted = 0;
        for (VerificationCondition vc : conditions) {
            ExpSimplifier simplifier = new ExpSimplifier(env, spec_mode);
            for (Expression e : context) {
                simplifier.assume(e);
            }
            Expression ret = simplifier.simplify(vc.getCondition());
            results.put(vc.getName(), ret);
            String outcome;
            if (ExpressionTools.isBoolConst(ret, true)) {
                num_discharged++;
                outcome = "discharged";
            } else if (ExpressionTools.isBoolConst(ret, false) ||
                       simplifier.isForallProvablyFalse(ret)) {
                num_refuted++;
                outcome = "refuted";
            } else {
                outcome = "remaining " + ret;
            }
            PrintTools.printlnStatus(1, pass_name, vc.getName(), outcome,
                    "(nodes", ExpressionTools.getNodeCount(vc.getCondition()),
                    "->", ExpressionTools.getNodeCount(ret) + ")");
        }
        PrintTools.printlnStatus(1, pass_name, "discharged", num_discharged,
                "refuted", num_refuted, "of", conditions.size());
    }

    /** Returns the simplified conditions by name, in input order. */
    public Map<String, Expression> getResults() {
        return Collections.unmodifiableMap(results);
    }

    /**
    * Returns the simplified form of the named condition.
    *
    * @return the result, or null if the pass has not processed the name.
    */
    public Expression getResult(String name) {
        return results.get(name);
    }

    public int getNumDischarged() {
        return num_discharged;
    }

    public int getNumRefuted() {
        return num_refuted;
    }
}
