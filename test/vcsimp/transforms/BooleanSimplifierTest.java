package vcsimp.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import static vcsimp.hir.ExpressionFactory.mkAnd;
import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkEq;
import static vcsimp.hir.ExpressionFactory.mkGe;
import static vcsimp.hir.ExpressionFactory.mkGt;
import static vcsimp.hir.ExpressionFactory.mkImplies;
import static vcsimp.hir.ExpressionFactory.mkLe;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkLt;
import static vcsimp.hir.ExpressionFactory.mkNumber;
import static vcsimp.hir.ExpressionFactory.mkOr;

import java.util.ArrayList;

import org.junit.Test;

import vcsimp.hir.Expression;
import vcsimp.hir.ExpressionFactory;
import vcsimp.hir.Operator;
import vcsimp.hir.PrimitiveType;

public class BooleanSimplifierTest {

    private final Expression x = mkLocal("x", PrimitiveType.U64);
    private final Expression n = mkLocal("n", PrimitiveType.U64);
    private final Expression p = mkLocal("p", PrimitiveType.BOOL);
    private final Expression q = mkLocal("q", PrimitiveType.BOOL);
    private final Expression r = mkLocal("r", PrimitiveType.BOOL);

    private static Expression num(long v) {
        return mkNumber(v, PrimitiveType.U64);
    }

    @Test
    public void testNot() {
        assertEquals(mkBool(false), BooleanSimplifier.mkNot(mkBool(true)));
        assertEquals(p, BooleanSimplifier.mkNot(ExpressionFactory.mkNot(p)));
        assertEquals(ExpressionFactory.mkNot(p), BooleanSimplifier.mkNot(p));
        assertEquals(mkGt(x, n), BooleanSimplifier.mkNot(mkLe(x, n)));
        assertEquals(mkLe(x, n), BooleanSimplifier.mkNot(mkGt(x, n)));
        assertEquals(ExpressionFactory.mkNeq(x, n),
                BooleanSimplifier.mkNot(mkEq(x, n)));
    }

    @Test
    public void testNotOfPositiveUnsigned() {
        assertEquals(mkEq(x, num(0)), BooleanSimplifier.mkNot(mkLt(num(0), x)));
        Expression z = mkLocal("z", PrimitiveType.NUM);
        assertEquals(mkGe(mkNumber(0, PrimitiveType.NUM), z),
                BooleanSimplifier.mkNot(mkLt(mkNumber(0, PrimitiveType.NUM), z)));
    }

    @Test
    public void testAndIdentities() {
        assertEquals(p, BooleanSimplifier.mkAnd(p, mkBool(true)));
        assertEquals(p, BooleanSimplifier.mkAnd(mkBool(true), p));
        assertEquals(mkBool(false), BooleanSimplifier.mkAnd(p, mkBool(false)));
        assertEquals(p, BooleanSimplifier.mkAnd(p, p));
        assertEquals(mkBool(false),
                BooleanSimplifier.mkAnd(p, ExpressionFactory.mkNot(p)));
        assertEquals(mkAnd(p, q), BooleanSimplifier.mkAnd(p, q));
    }

    @Test
    public void testAndKeepsStrongerComparison() {
        assertEquals(mkLt(x, num(3)),
                BooleanSimplifier.mkAnd(mkLt(x, num(5)), mkLt(x, num(3))));
        assertEquals(mkLt(x, num(3)),
                BooleanSimplifier.mkAnd(mkLt(x, num(3)), mkLt(x, num(5))));
        Expression conj = mkAnd(p, mkLt(x, num(3)));
        assertEquals(conj, BooleanSimplifier.mkAnd(conj, mkLt(x, num(5))));
    }

    @Test
    public void testAndOfBounds() {
        assertEquals(mkEq(x, n),
                BooleanSimplifier.mkAnd(mkLe(x, n), mkGe(x, n)));
        assertEquals(mkEq(x, num(6)), BooleanSimplifier.mkAnd(
                mkLt(num(5), x), ExpressionFactory.mkNot(mkLt(num(6), x))));
        assertEquals(mkBool(false),
                BooleanSimplifier.mkAnd(mkLt(num(3), x), mkLt(x, num(4))));
    }

    @Test
    public void testOr() {
        assertEquals(p, BooleanSimplifier.mkOr(p, mkBool(false)));
        assertEquals(mkBool(true), BooleanSimplifier.mkOr(mkBool(true), p));
        assertEquals(p, BooleanSimplifier.mkOr(p, p));
        assertEquals(mkBool(true),
                BooleanSimplifier.mkOr(ExpressionFactory.mkNot(p), p));
        assertEquals(mkLt(x, num(5)),
                BooleanSimplifier.mkOr(mkLt(x, num(5)), mkLt(x, num(3))));
        assertEquals(mkOr(p, q), BooleanSimplifier.mkOr(p, q));
    }

    @Test
    public void testImplies() {
        assertEquals(p, BooleanSimplifier.mkImplies(mkBool(true), p));
        assertEquals(mkBool(true), BooleanSimplifier.mkImplies(mkBool(false), p));
        assertEquals(mkBool(true), BooleanSimplifier.mkImplies(p, mkBool(true)));
        assertEquals(ExpressionFactory.mkNot(p),
                BooleanSimplifier.mkImplies(p, mkBool(false)));
        assertEquals(mkImplies(p, q), BooleanSimplifier.mkImplies(p, q));
    }

    @Test
    public void testNestedImplications() {
        assertEquals(mkImplies(mkAnd(p, q), r),
                BooleanSimplifier.mkImplies(p, mkImplies(q, r)));
        assertEquals(mkBool(true), BooleanSimplifier.mkImplies(p,
                mkImplies(ExpressionFactory.mkNot(p), r)));
        assertEquals(mkImplies(p, r),
                BooleanSimplifier.mkImplies(p, mkImplies(p, r)));
        // 3 < x implies 2 < x, so only the stronger antecedent stays
        assertEquals(mkImplies(mkLt(num(3), x), r),
                BooleanSimplifier.mkImplies(mkLt(num(2), x),
                mkImplies(mkLt(num(3), x), r)));
    }

    @Test
    public void testIff() {
        assertEquals(mkBool(true), BooleanSimplifier.mkIff(p, p));
        assertEquals(q, BooleanSimplifier.mkIff(mkBool(true), q));
        assertEquals(ExpressionFactory.mkNot(p),
                BooleanSimplifier.mkIff(p, mkBool(false)));
        assertEquals(ExpressionFactory.mkIff(p, q),
                BooleanSimplifier.mkIff(p, q));
    }

    @Test
    public void testAndAll() {
        assertEquals(mkBool(true),
                BooleanSimplifier.mkAndAll(new ArrayList<Expression>()));
        assertEquals(mkAnd(p, q), BooleanSimplifier.mkAndAll(
                ExpressionFactory.list(p, mkBool(true), q)));
    }

    @Test
    public void testDispatch() {
        assertEquals(p, BooleanSimplifier.simplify(Operator.AND, p,
                mkBool(true)));
        assertNull(BooleanSimplifier.simplify(Operator.ADD, x, n));
    }
}
