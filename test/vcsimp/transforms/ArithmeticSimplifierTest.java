package vcsimp.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import static vcsimp.hir.ExpressionFactory.mkAdd;
import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkCall;
import static vcsimp.hir.ExpressionFactory.mkEq;
import static vcsimp.hir.ExpressionFactory.mkGe;
import static vcsimp.hir.ExpressionFactory.mkGt;
import static vcsimp.hir.ExpressionFactory.mkLe;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkLt;
import static vcsimp.hir.ExpressionFactory.mkMul;
import static vcsimp.hir.ExpressionFactory.mkNeq;
import static vcsimp.hir.ExpressionFactory.mkNumber;
import static vcsimp.hir.ExpressionFactory.mkSub;

import org.junit.Test;

import vcsimp.hir.CallExpression;
import vcsimp.hir.Expression;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;

public class ArithmeticSimplifierTest {

    private final ArithmeticSimplifier spec = new ArithmeticSimplifier(true);

    private final ArithmeticSimplifier program = new ArithmeticSimplifier(false);

    private final Expression x = mkLocal("x", PrimitiveType.U64);

    private final Expression y = mkLocal("y", PrimitiveType.U64);

    private final Expression b = mkLocal("b", PrimitiveType.U8);

    private static Expression num(long v) {
        return mkNumber(v, PrimitiveType.U64);
    }

    @Test
    public void testModes() {
        assertTrue(spec.isSpecMode());
        assertFalse(program.isSpecMode());
    }

    @Test
    public void testNeutralElements() {
        assertEquals(x, spec.simplifyArithmetic(mkAdd(x, num(0))));
        assertEquals(x, spec.simplifyArithmetic(mkAdd(num(0), x)));
        assertEquals(x, spec.simplifyArithmetic(mkSub(x, num(0))));
        assertEquals(x, spec.simplifyArithmetic(mkMul(x, num(1))));
        assertEquals(x, spec.simplifyArithmetic(mkMul(num(1), x)));
        assertEquals(x, spec.simplifyArithmetic(
                mkCall(PrimitiveType.U64, Operator.DIV, x, num(1))));
    }

    @Test
    public void testAbsorbingElements() {
        assertEquals(num(0), spec.simplifyArithmetic(mkSub(x, x)));
        assertEquals(num(0), spec.simplifyArithmetic(mkMul(x, num(0))));
        assertEquals(num(0), spec.simplifyArithmetic(mkMul(num(0), x)));
        assertEquals(num(0), spec.simplifyArithmetic(
                mkCall(PrimitiveType.U64, Operator.MOD, x, num(1))));
    }

    @Test
    public void testMergeConstants() {
        assertEquals(mkAdd(x, num(5)),
                spec.simplifyArithmetic(mkAdd(mkAdd(x, num(2)), num(3))));
        assertEquals(mkSub(x, num(3)),
                spec.simplifyArithmetic(mkSub(mkAdd(x, num(2)), num(5))));
        assertEquals(mkAdd(x, num(1)),
                spec.simplifyArithmetic(mkSub(mkAdd(x, num(4)), num(3))));
        assertEquals(mkSub(x, num(5)),
                spec.simplifyArithmetic(mkSub(mkSub(x, num(2)), num(3))));
        assertEquals(mkSub(x, num(3)),
                spec.simplifyArithmetic(mkAdd(mkSub(x, num(5)), num(2))));
        assertEquals(x,
                spec.simplifyArithmetic(mkAdd(mkSub(x, num(2)), num(2))));
        assertEquals(mkMul(x, num(6)),
                spec.simplifyArithmetic(mkMul(mkMul(x, num(2)), num(3))));
    }

    @Test
    public void testNoRule() {
        assertNull(spec.simplifyArithmetic(mkAdd(x, y)));
        assertNull(spec.simplifyArithmetic(mkMul(x, num(2))));
    }

    @Test
    public void testProgramModeKeepsArithmetic() {
        assertNull(program.simplifyArithmetic(mkAdd(x, num(0))));
        assertNull(program.simplifyArithmetic(mkSub(x, x)));
        assertNull(program.simplifyArithmetic(mkAdd(mkAdd(x, num(2)), num(3))));
    }

    @Test
    public void testReflexiveComparisons() {
        assertEquals(mkBool(true), spec.simplifyComparison(mkEq(x, x)));
        assertEquals(mkBool(true), spec.simplifyComparison(mkLe(x, x)));
        assertEquals(mkBool(true), spec.simplifyComparison(mkGe(x, x)));
        assertEquals(mkBool(false), spec.simplifyComparison(mkLt(x, x)));
        assertEquals(mkBool(false), spec.simplifyComparison(mkGt(x, x)));
        assertEquals(mkBool(false), spec.simplifyComparison(mkNeq(x, x)));
        assertEquals(mkBool(false), program.simplifyComparison(mkLt(x, x)));
    }

    @Test
    public void testTypeBounds() {
        Expression max = mkNumber(255, PrimitiveType.U8);
        assertEquals(mkBool(false), spec.simplifyComparison(mkGt(b, max)));
        assertEquals(mkBool(false), spec.simplifyComparison(mkLt(max, b)));
        assertEquals(mkBool(true), spec.simplifyComparison(mkLe(b, max)));
        assertEquals(mkBool(true), spec.simplifyComparison(mkGe(x, num(0))));
        assertEquals(mkBool(false), spec.simplifyComparison(mkLt(x, num(0))));
        assertEquals(mkBool(true), program.simplifyComparison(mkLe(num(0), x)));
        assertNull(spec.simplifyComparison(mkLt(b, mkNumber(200, PrimitiveType.U8))));
        Expression n = mkLocal("n", PrimitiveType.NUM);
        assertNull(spec.simplifyComparison(
                mkGe(n, mkNumber(0, PrimitiveType.NUM))));
    }

    @Test
    public void testAddendNormalization() {
        assertEquals(mkLt(x, num(4)),
                spec.simplifyComparison(mkLt(mkAdd(x, num(1)), num(5))));
        assertEquals(mkGt(x, num(7)),
                spec.simplifyComparison(mkLt(num(5), mkSub(x, num(2)))));
        assertEquals(mkBool(false),
                spec.simplifyComparison(mkLe(mkAdd(x, num(1)), num(0))));
        assertNull(program.simplifyComparison(mkLt(mkAdd(x, num(1)), num(5))));
        assertNull(spec.simplifyComparison(mkLt(mkAdd(x, y), num(5))));
    }

    @Test
    public void testNonComparison() {
        CallExpression add = mkAdd(x, y);
        assertNull(spec.simplifyComparison(add));
    }
}
