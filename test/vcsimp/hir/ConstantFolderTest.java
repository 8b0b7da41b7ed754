package vcsimp.hir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import static vcsimp.hir.ExpressionFactory.mkBool;
import static vcsimp.hir.ExpressionFactory.mkCall;
import static vcsimp.hir.ExpressionFactory.mkNumber;

import org.junit.Test;

public class ConstantFolderTest {

    private static Literal fold(Type type, Operator op, Expression... args) {
        return ConstantFolder.fold(mkCall(type, op, args));
    }

    @Test
    public void testArithmetic() {
        PrimitiveType u64 = PrimitiveType.U64;
        assertEquals(mkNumber(7, u64),
                fold(u64, Operator.ADD, mkNumber(3, u64), mkNumber(4, u64)));
        assertEquals(mkNumber(12, u64),
                fold(u64, Operator.MUL, mkNumber(3, u64), mkNumber(4, u64)));
        assertEquals(mkNumber(3, u64),
                fold(u64, Operator.DIV, mkNumber(7, u64), mkNumber(2, u64)));
        assertEquals(mkNumber(1, u64),
                fold(u64, Operator.MOD, mkNumber(7, u64), mkNumber(2, u64)));
    }

    @Test
    public void testBoundedResultsStayVisible() {
        PrimitiveType u8 = PrimitiveType.U8;
        assertEquals(mkNumber(255, u8),
                fold(u8, Operator.ADD, mkNumber(200, u8), mkNumber(55, u8)));
        // overflow and underflow abort at run time
        assertNull(fold(u8, Operator.ADD, mkNumber(200, u8), mkNumber(56, u8)));
        assertNull(fold(PrimitiveType.U64, Operator.SUB,
                mkNumber(3, PrimitiveType.U64), mkNumber(5, PrimitiveType.U64)));
        // unbounded spec numbers may go negative
        assertEquals(mkNumber(-2, PrimitiveType.NUM),
                fold(PrimitiveType.NUM, Operator.SUB,
                mkNumber(3, PrimitiveType.NUM), mkNumber(5, PrimitiveType.NUM)));
    }

    @Test
    public void testDivisionByZero() {
        PrimitiveType u64 = PrimitiveType.U64;
        assertNull(fold(u64, Operator.DIV, mkNumber(7, u64), mkNumber(0, u64)));
        assertNull(fold(u64, Operator.MOD, mkNumber(7, u64), mkNumber(0, u64)));
    }

    @Test
    public void testComparisons() {
        PrimitiveType u64 = PrimitiveType.U64;
        PrimitiveType bool = PrimitiveType.BOOL;
        assertEquals(mkBool(true),
                fold(bool, Operator.LT, mkNumber(3, u64), mkNumber(5, u64)));
        assertEquals(mkBool(false),
                fold(bool, Operator.GE, mkNumber(3, u64), mkNumber(5, u64)));
        assertEquals(mkBool(true),
                fold(bool, Operator.NEQ, mkNumber(3, u64), mkNumber(5, u64)));
        assertEquals(mkBool(true),
                fold(bool, Operator.EQ, mkBool(false), mkBool(false)));
        assertNull(fold(bool, Operator.LT, mkBool(false), mkBool(true)));
    }

    @Test
    public void testConnectives() {
        PrimitiveType bool = PrimitiveType.BOOL;
        assertEquals(mkBool(false), fold(bool, Operator.NOT, mkBool(true)));
        assertEquals(mkBool(false),
                fold(bool, Operator.AND, mkBool(true), mkBool(false)));
        assertEquals(mkBool(true),
                fold(bool, Operator.OR, mkBool(true), mkBool(false)));
        assertEquals(mkBool(true),
                fold(bool, Operator.IMPLIES, mkBool(false), mkBool(false)));
        assertEquals(mkBool(false),
                fold(bool, Operator.IFF, mkBool(true), mkBool(false)));
    }

    @Test
    public void testNonLiteralArguments() {
        Identifier x = ExpressionFactory.mkLocal("x", PrimitiveType.U64);
        assertNull(fold(PrimitiveType.U64, Operator.ADD, x,
                mkNumber(1, PrimitiveType.U64)));
        assertNull(ConstantFolder.fold(
                mkCall(PrimitiveType.U8, Operator.MAX_U8)));
    }

}
