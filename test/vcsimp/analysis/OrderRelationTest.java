package vcsimp.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import static vcsimp.hir.ExpressionFactory.mkGe;
import static vcsimp.hir.ExpressionFactory.mkGt;
import static vcsimp.hir.ExpressionFactory.mkLe;
import static vcsimp.hir.ExpressionFactory.mkLocal;
import static vcsimp.hir.ExpressionFactory.mkLt;
import static vcsimp.hir.ExpressionFactory.mkNot;

import org.junit.Test;

import vcsimp.hir.Expression;
import vcsimp.hir.PrimitiveType;

public class OrderRelationTest {

    private final Expression a = mkLocal("a", PrimitiveType.U64);
    private final Expression b = mkLocal("b", PrimitiveType.U64);

    private void assertRelation(OrderRelation r) {
        assertEquals(a, r.getLHS());
        assertEquals(b, r.getRHS());
    }

    @Test
    public void testLessThan() {
        assertRelation(OrderRelation.lessThan(mkLt(a, b)));
        assertRelation(OrderRelation.lessThan(mkGt(b, a)));
        assertNull(OrderRelation.lessThan(mkLe(a, b)));
        assertNull(OrderRelation.lessThan(a));
    }

    @Test
    public void testNotLessThan() {
        assertRelation(OrderRelation.notLessThan(mkGe(a, b)));
        assertRelation(OrderRelation.notLessThan(mkLe(b, a)));
        assertRelation(OrderRelation.notLessThan(mkNot(mkLt(a, b))));
        assertRelation(OrderRelation.notLessThan(mkNot(mkGt(b, a))));
        assertNull(OrderRelation.notLessThan(mkLt(a, b)));
        assertNull(OrderRelation.notLessThan(mkNot(mkLe(a, b))));
    }

    @Test
    public void testLessOrEqual() {
        assertRelation(OrderRelation.lessOrEqual(mkLe(a, b)));
        assertRelation(OrderRelation.lessOrEqual(mkGe(b, a)));
        assertNull(OrderRelation.lessOrEqual(mkNot(mkGt(a, b))));
        assertEquals("(a, b)", OrderRelation.lessOrEqual(mkLe(a, b)).toString());
    }
}
