package vcsimp.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import static vcsimp.hir.ExpressionFactory.mkAdd;
import static vcsimp.hir.ExpressionFactory.mkAnd;
import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkEq;
import static vcsimp.hir.ExpressionFactory.mkGe;
import static vcsimp.hir.ExpressionFactory.mkGt;
import static vcsimp.hir.ExpressionFactory.mkLe;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkLt;
import static vcsimp.hir.ExpressionFactory.mkMul;
import static vcsimp.hir.ExpressionFactory.mkNot;
import static vcsimp.hir.ExpressionFactory.mkNumber;

import org.junit.Test;

import vcsimp.hir.Expression;
import vcsimp.hir.PrimitiveType;

public class ComparisonReasonerTest {

    private final Expression x = mkLocal("x", PrimitiveType.U64);
    private final Expression n = mkLocal("n", PrimitiveType.U64);
    private final Expression r = mkLocal("r", PrimitiveType.U64);
    private final Expression p = mkLocal("p", PrimitiveType.BOOL);
    private final Expression q = mkLocal("q", PrimitiveType.BOOL);

    private static Expression num(long v) {
        return mkNumber(v, PrimitiveType.U64);
    }

    @Test
    public void testLowerBoundsOnSameOperand() {
        assertTrue(ComparisonReasoner.impliesComparison(
                mkLt(num(3), n), mkLt(num(2), n)));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkLt(num(2), n), mkLt(num(3), n)));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkGt(n, num(3)), mkLt(num(3), n)));
    }

    @Test
    public void testUpperBoundsOnSameOperand() {
        assertTrue(ComparisonReasoner.impliesComparison(
                mkLt(x, num(3)), mkLt(x, num(5))));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkLt(x, num(5)), mkLt(x, num(3))));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkLe(x, num(3)), mkLe(x, num(5))));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkGe(x, num(5)), mkGe(x, num(3))));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkGe(x, num(3)), mkGe(x, num(5))));
    }

    @Test
    public void testAdditiveOffsets() {
        assertTrue(ComparisonReasoner.impliesComparison(
                mkLt(mkAdd(x, num(2)), n), mkLt(mkAdd(x, num(1)), n)));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkLt(mkAdd(x, num(1)), n), mkLt(x, n)));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkLt(x, n), mkLt(mkAdd(x, num(1)), n)));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkGe(x, n), mkGe(mkAdd(x, num(1)), n)));
    }

    @Test
    public void testMultiplicativeFactors() {
        assertTrue(ComparisonReasoner.impliesComparison(
                mkGe(mkMul(x, num(2)), r), mkGe(mkMul(x, num(3)), r)));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkGe(mkMul(x, num(3)), r), mkGe(mkMul(x, num(2)), r)));
        Expression z = mkLocal("z", PrimitiveType.NUM);
        Expression s = mkLocal("s", PrimitiveType.NUM);
        assertFalse(ComparisonReasoner.impliesComparison(
                mkGe(mkMul(z, mkNumber(2, PrimitiveType.NUM)), s),
                mkGe(mkMul(z, mkNumber(3, PrimitiveType.NUM)), s)));
    }

    @Test
    public void testEqualityAgainstBounds() {
        assertTrue(ComparisonReasoner.impliesComparison(
                mkEq(x, num(5)), mkLt(x, num(10))));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkEq(num(5), x), mkLt(num(4), x)));
        assertTrue(ComparisonReasoner.impliesComparison(
                mkEq(x, num(5)), mkLe(x, num(5))));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkEq(x, num(5)), mkLt(x, num(5))));
        assertFalse(ComparisonReasoner.impliesComparison(
                mkEq(x, n), mkLt(x, num(5))));
    }

    @Test
    public void testStrictImpliesNonStrict() {
        assertTrue(ComparisonReasoner.impliesComparison(mkLt(x, n),
                mkLe(x, n)));
        assertTrue(ComparisonReasoner.impliesComparison(mkGt(x, n),
                mkGe(x, n)));
        assertFalse(ComparisonReasoner.impliesComparison(mkLe(x, n),
                mkLt(x, n)));
    }

    @Test
    public void testConjunctionImplies() {
        Expression conj = mkAnd(p, mkAnd(mkLt(x, num(3)), q));
        assertTrue(ComparisonReasoner.conjunctionImpliesComparison(conj,
                mkLt(x, num(5))));
        assertFalse(ComparisonReasoner.conjunctionImpliesComparison(
                mkLt(x, num(3)), mkLt(x, num(5))));
    }

    @Test
    public void testSubsumes() {
        assertTrue(ComparisonReasoner.subsumes(mkLt(x, num(5)),
                mkLt(x, num(3))));
        assertFalse(ComparisonReasoner.subsumes(mkLt(x, num(3)),
                mkLt(x, num(5))));
        assertTrue(ComparisonReasoner.subsumes(mkNot(mkLt(x, num(3))),
                mkNot(mkLt(x, num(5)))));
        assertTrue(ComparisonReasoner.subsumes(p, mkAnd(q, p)));
        assertFalse(ComparisonReasoner.subsumes(p, q));
    }

    @Test
    public void testComplements() {
        assertTrue(ComparisonReasoner.isComplementary(p, mkNot(p)));
        assertTrue(ComparisonReasoner.isComplementary(mkNot(p), p));
        assertFalse(ComparisonReasoner.isComplementary(p, q));
        assertTrue(ComparisonReasoner.impliesComplementary(
                mkLt(num(3), x), mkNot(mkLt(num(2), x))));
        assertTrue(ComparisonReasoner.impliesComplementary(
                mkNot(mkLt(num(3), x)), mkLt(num(5), x)));
        assertFalse(ComparisonReasoner.impliesComplementary(
                mkNot(mkLt(num(5), x)), mkLt(num(3), x)));
    }

    @Test
    public void testAntisymmetry() {
        assertEquals(mkEq(x, n),
                ComparisonReasoner.tryAntisymmetryToEq(mkLe(x, n), mkGe(x, n)));
        assertEquals(mkEq(x, n),
                ComparisonReasoner.tryAntisymmetryToEq(mkLe(x, n), mkLe(n, x)));
        assertNull(ComparisonReasoner.tryAntisymmetryToEq(mkLe(x, n),
                mkLe(x, r)));
        assertNull(ComparisonReasoner.tryAntisymmetryToEq(mkLt(x, n),
                mkGt(x, n)));
    }

    @Test
    public void testPinchToEquality() {
        Expression expected = mkEq(x, num(6));
        assertEquals(expected, ComparisonReasoner.tryPinchToEq(
                mkLt(num(5), x), mkNot(mkLt(num(6), x))));
        assertEquals(expected, ComparisonReasoner.tryPinchToEq(
                mkNot(mkLt(num(6), x)), mkLt(num(5), x)));
        assertEquals(expected, ComparisonReasoner.tryPinchToEq(
                mkLt(num(5), x), mkLe(x, num(6))));
        assertEquals(expected, ComparisonReasoner.tryPinchToEq(
                mkLt(x, num(7)), mkGe(x, num(6))));
        assertNull(ComparisonReasoner.tryPinchToEq(
                mkLt(num(5), x), mkLe(x, num(7))));
    }

    @Test
    public void testEmptyRange() {
        assertEquals(mkBool(false), ComparisonReasoner.tryEmptyRange(
                mkLt(num(3), x), mkLt(x, num(4))));
        assertEquals(mkBool(false), ComparisonReasoner.tryEmptyRange(
                mkGt(num(4), x), mkGt(x, num(3))));
        assertNull(ComparisonReasoner.tryEmptyRange(
                mkLt(num(3), x), mkLt(x, num(5))));
    }
}
