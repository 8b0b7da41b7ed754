package vcsimp.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkEq;
import static vcsimp.hir.ExpressionFactory.mkForall;
import static vcsimp.hir.ExpressionFactory.mkGt;
import static vcsimp.hir.ExpressionFactory.mkImplies;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkLt;
import static vcsimp.hir.ExpressionFactory.mkNumber;
import static vcsimp.hir.ExpressionFactory.mkTemporary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import vcsimp.hir.Expression;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.Identifier;
import vcsimp.hir.PrimitiveType;
import vcsimp.hir.QuantifierExpression;
import vcsimp.transforms.SimplificationPass.VerificationCondition;

public class SimplificationPassTest {

    private final Identifier x = mkLocal("x", PrimitiveType.U64);
    private final Expression n = mkLocal("n", PrimitiveType.U64);
    private final Expression m = mkLocal("m", PrimitiveType.U64);
    private final Expression t0 = mkTemporary(0, PrimitiveType.U64);

    private static Expression num(long v) {
        return mkNumber(v, PrimitiveType.U64);
    }

    @Test
    public void testDischargeAndRefute() {
        List<Expression> context = Collections.singletonList(mkLt(num(3), t0));
        List<VerificationCondition> vcs = new ArrayList<VerificationCondition>();
        vcs.add(new VerificationCondition("bounds",
                mkImplies(mkLt(num(2), t0), mkLt(num(1), t0))));
        vcs.add(new VerificationCondition("zero", mkEq(t0, num(0))));
        vcs.add(new VerificationCondition("unbounded", mkForall(x, mkGt(x, n))));
        vcs.add(new VerificationCondition("open", mkLt(n, m)));
        SimplificationPass pass = new SimplificationPass(new GlobalEnv(),
                context, vcs);
        TransformPass.run(pass);

        assertEquals(1, pass.getNumDischarged());
        assertEquals(2, pass.getNumRefuted());
        assertEquals(mkBool(true), pass.getResult("bounds"));
        assertEquals(mkBool(false), pass.getResult("zero"));
        assertTrue(pass.getResult("unbounded") instanceof QuantifierExpression);
        assertEquals(mkLt(n, m), pass.getResult("open"));
        assertNull(pass.getResult("missing"));

        Map<String, Expression> results = pass.getResults();
        assertEquals(4, results.size());
        assertEquals("bounds", results.keySet().iterator().next());
    }

    @Test
    public void testContextDoesNotLeakBetweenConditions() {
        List<VerificationCondition> vcs = new ArrayList<VerificationCondition>();
        vcs.add(new VerificationCondition("first",
                mkImplies(mkEq(n, num(4)), mkLt(n, m))));
        vcs.add(new VerificationCondition("second", mkLt(n, m)));
        SimplificationPass pass = new SimplificationPass(new GlobalEnv(),
                new ArrayList<Expression>(), vcs);
        pass.start();
        assertEquals(mkImplies(mkEq(n, num(4)), mkLt(num(4), m)),
                pass.getResult("first"));
        assertEquals(mkLt(n, m), pass.getResult("second"));
        assertEquals(0, pass.getNumDischarged());
        assertEquals("[SimplificationPass]", pass.getPassName());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testConditionNeedsName() {
        new VerificationCondition(null, mkBool(true));
    }
}
