package vcsimp.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import static vcsimp.hir.ExpressionFactory.list;
import static vcsimp.hir.ExpressionFactory.mkAdd;
import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkCall;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkNumber;
import static vcsimp.hir.ExpressionFactory.mkOld;
import static vcsimp.hir.ExpressionFactory.mkPack;
import static vcsimp.hir.ExpressionFactory.mkSelect;
import static vcsimp.hir.ExpressionFactory.mkSpecCall;
import static vcsimp.hir.ExpressionFactory.mkUpdateField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.FieldDecl;
import vcsimp.hir.GlobalEnv;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;
import vcsimp.hir.SpecFunctionDecl;
import vcsimp.hir.StructDecl;
import vcsimp.hir.Symbol;
import vcsimp.hir.Type;

public class SpecialOperatorRulesTest {

    private GlobalEnv env;

    private StructDecl coin;

    private SpecFunctionDecl inc;

    private SpecFunctionDecl hash;

    private SpecialOperatorRules spec;

    private SpecialOperatorRules program;

    private final Expression x = mkLocal("x", PrimitiveType.U64);

    private final Expression n = mkLocal("n", PrimitiveType.U64);

    private final Expression p = mkLocal("p", PrimitiveType.BOOL);

    private static Expression num(long v) {
        return mkNumber(v, PrimitiveType.U64);
    }

    @Before
    public void setUp() {
        env = new GlobalEnv();
        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        fields.add(new FieldDecl("frozen", 1, PrimitiveType.BOOL));
        fields.add(new FieldDecl("value", 0, PrimitiveType.U64));
        coin = new StructDecl("Coin", fields, false);
        env.addStruct(coin);
        Symbol v = new Symbol("v");
        inc = new SpecFunctionDecl("inc", Collections.singletonList(v),
                Collections.<Type>singletonList(PrimitiveType.U64),
                PrimitiveType.U64, mkAdd(mkLocal(v, PrimitiveType.U64), num(1)),
                false, false);
        env.addSpecFunction(inc);
        hash = new SpecFunctionDecl("hash", Collections.singletonList(v),
                Collections.<Type>singletonList(PrimitiveType.U64),
                PrimitiveType.U64, null, true, false);
        env.addSpecFunction(hash);
        spec = new SpecialOperatorRules(env, true);
        program = new SpecialOperatorRules(env, false);
    }

    @Test
    public void testMaxConstants() {
        assertEquals(num(255),
                spec.simplify(mkCall(PrimitiveType.U8, Operator.MAX_U8)));
        assertEquals(mkNumber(PrimitiveType.U64.getMaxValue(), PrimitiveType.U64),
                spec.simplify(mkCall(PrimitiveType.U64, Operator.MAX_U64)));
    }

    @Test
    public void testOld() {
        assertEquals(mkOld(x), spec.simplify(mkOld(mkOld(x))));
        assertNull(spec.simplify(mkOld(x)));
    }

    @Test
    public void testFreeze() {
        CallExpression freeze = mkCall(PrimitiveType.U64, Operator.FREEZE, x);
        assertEquals(x, spec.simplify(freeze));
        assertNull(program.simplify(freeze));
    }

    @Test
    public void testVerificationOnlyPredicates() {
        assertEquals(mkBool(true), spec.simplify(
                mkCall(PrimitiveType.BOOL, Operator.WELL_FORMED, x)));
        assertEquals(mkBool(false), program.simplify(
                mkCall(PrimitiveType.BOOL, Operator.ABORT_FLAG)));
        assertNull(spec.simplify(mkAdd(x, n)));
    }

    @Test
    public void testSelectOfPack() {
        Expression pack = mkPack(coin, list(n, p));
        assertEquals(n, spec.simplify(mkSelect(coin, "value", pack)));
        assertEquals(p, spec.simplify(mkSelect(coin, "frozen", pack)));
        assertNull(spec.simplify((CallExpression)pack));
    }

    @Test
    public void testSelectOfUpdate() {
        Expression c = mkLocal("c", coin.getType());
        Expression update = mkUpdateField(coin, "value", c, num(7));
        assertEquals(num(7), spec.simplify(mkSelect(coin, "value", update)));
        assertNull(spec.simplify(mkSelect(coin, "frozen", update)));
        assertNull(spec.simplify(mkSelect(coin, "value", c)));
    }

    @Test
    public void testUpdateOfUpdate() {
        Expression c = mkLocal("c", coin.getType());
        Expression inner = mkUpdateField(coin, "value", c, num(1));
        assertEquals(mkUpdateField(coin, "value", c, num(2)),
                spec.simplify(mkUpdateField(coin, "value", inner, num(2))));
        assertNull(spec.simplify(mkUpdateField(coin, "frozen", inner, p)));
    }

    @Test
    public void testUpdateOfPack() {
        Expression pack = mkPack(coin, list(n, p));
        assertEquals(mkPack(coin, list(num(7), p)),
                spec.simplify(mkUpdateField(coin, "value", pack, num(7))));
        assertEquals(mkPack(coin, list(n, mkBool(true))),
                spec.simplify(mkUpdateField(coin, "frozen", pack,
                mkBool(true))));
    }

    @Test
    public void testUnfoldSpecFunction() {
        assertEquals(mkAdd(num(5), num(1)),
                spec.unfoldSpecFunction(mkSpecCall(inc, num(5))));
        assertNull(spec.unfoldSpecFunction(mkSpecCall(inc, x)));
        assertNull(spec.unfoldSpecFunction(mkSpecCall(hash, num(5))));
        assertNull(spec.unfoldSpecFunction(mkAdd(num(5), num(1))));
    }
}
