package vcsimp.hir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* <b>ExpressionFactory</b> builds well-typed expression nodes. The builders
* perform no simplification; rules that need a simplified form call the
* rule sets in {@code vcsimp.transforms} instead.
*/
public final class ExpressionFactory {

    private ExpressionFactory() {
    }

    /** Returns the boolean literal for the given value. */
    public static BooleanLiteral mkBool(boolean value) {
        return BooleanLiteral.valueOf(value);
    }

    /** Returns an integer literal of the given type. */
    public static IntegerLiteral mkNumber(BigInteger value, Type type) {
        return new IntegerLiteral(value, type);
    }

    /** Returns an integer literal of the given type. */
    public static IntegerLiteral mkNumber(long value, Type type) {
        return new IntegerLiteral(value, type);
    }

    /** Returns a reference to a local variable. */
    public static Identifier mkLocal(Symbol symbol, Type type) {
        return new Identifier(symbol, type);
    }

    /** Returns a reference to a local variable with the given name. */
    public static Identifier mkLocal(String name, Type type) {
        return new Identifier(new Symbol(name), type);
    }

    /** Returns a reference to a temporary. */
    public static Temporary mkTemporary(int index, Type type) {
        return new Temporary(index, type);
    }

    /** Returns a call with the given result type. */
    public static CallExpression mkCall(Type type, Operator op,
            List<Expression> args) {
        return new CallExpression(op, args, type);
    }

    /** Returns a call with the given result type. */
    public static CallExpression mkCall(Type type, Operator op,
            Expression... args) {
        return new CallExpression(op, Arrays.asList(args), type);
    }

    /** Returns a call with boolean result type. */
    public static CallExpression mkBoolCall(Operator op, Expression... args) {
        return new CallExpression(op, Arrays.asList(args), PrimitiveType.BOOL);
    }

    /** Returns a call with boolean result type. */
    public static CallExpression mkBoolCall(Operator op,
            List<Expression> args) {
        return new CallExpression(op, args, PrimitiveType.BOOL);
    }

    public static CallExpression mkNot(Expression e) {
        return mkBoolCall(Operator.NOT, e);
    }

    public static CallExpression mkAnd(Expression e1, Expression e2) {
        return mkBoolCall(Operator.AND, e1, e2);
    }

    public static CallExpression mkOr(Expression e1, Expression e2) {
        return mkBoolCall(Operator.OR, e1, e2);
    }

    public static CallExpression mkImplies(Expression e1, Expression e2) {
        return mkBoolCall(Operator.IMPLIES, e1, e2);
    }

    public static CallExpression mkIff(Expression e1, Expression e2) {
        return mkBoolCall(Operator.IFF, e1, e2);
    }

    public static CallExpression mkEq(Expression e1, Expression e2) {
        return mkBoolCall(Operator.EQ, e1, e2);
    }

    public static CallExpression mkNeq(Expression e1, Expression e2) {
        return mkBoolCall(Operator.NEQ, e1, e2);
    }

    public static CallExpression mkLt(Expression e1, Expression e2) {
        return mkBoolCall(Operator.LT, e1, e2);
    }

    public static CallExpression mkLe(Expression e1, Expression e2) {
        return mkBoolCall(Operator.LE, e1, e2);
    }

    public static CallExpression mkGt(Expression e1, Expression e2) {
        return mkBoolCall(Operator.GT, e1, e2);
    }

    public static CallExpression mkGe(Expression e1, Expression e2) {
        return mkBoolCall(Operator.GE, e1, e2);
    }

    /** Returns {@code e1 + e2} typed like {@code e1}. */
    public static CallExpression mkAdd(Expression e1, Expression e2) {
        return mkCall(e1.getType(), Operator.ADD, e1, e2);
    }

    /** Returns {@code e1 - e2} typed like {@code e1}. */
    public static CallExpression mkSub(Expression e1, Expression e2) {
        return mkCall(e1.getType(), Operator.SUB, e1, e2);
    }

    /** Returns {@code e1 * e2} typed like {@code e1}. */
    public static CallExpression mkMul(Expression e1, Expression e2) {
        return mkCall(e1.getType(), Operator.MUL, e1, e2);
    }

    /** Returns {@code old(e)}. */
    public static CallExpression mkOld(Expression e) {
        return mkCall(e.getType(), Operator.OLD, e);
    }

    /**
    * Returns a struct value built from field values given in offset order.
    *
    * @throws IllegalArgumentException if the number of values differs from
    *   the number of fields.
    */
    public static CallExpression mkPack(StructDecl decl,
            List<Expression> field_values) {
        if (field_values.size() != decl.getFields().size()) {
            throw new IllegalArgumentException("pack of " + decl.getName() +
                    " needs " + decl.getFields().size() + " values");
        }
        return new CallExpression(StructOperator.pack(decl.getName()),
                field_values, decl.getType());
    }

    /** Returns {@code e.field}. */
    public static CallExpression mkSelect(StructDecl decl, String field,
            Expression e) {
        return mkCall(decl.getField(field).getType(),
                StructOperator.select(decl.getName(), field), e);
    }

    /** Returns a copy of the struct value {@code e} with {@code field} set. */
    public static CallExpression mkUpdateField(StructDecl decl, String field,
            Expression e, Expression value) {
        decl.getField(field);
        return mkCall(decl.getType(),
                StructOperator.updateField(decl.getName(), field), e, value);
    }

    /** Returns a call of the given spec function. */
    public static CallExpression mkSpecCall(SpecFunctionDecl decl,
            Expression... args) {
        return mkCall(decl.getResultType(),
                new SpecFunctionOperator(decl.getName()), args);
    }

    public static ConditionalExpression mkIfElse(Expression cond,
            Expression then_expr, Expression else_expr) {
        return new ConditionalExpression(cond, then_expr, else_expr);
    }

    /** Returns the domain of all values of a type. */
    public static CallExpression mkTypeDomain(Type type) {
        return mkCall(type, Operator.TYPE_DOMAIN);
    }

    /** Returns a range binding the symbol over its whole type. */
    public static QuantifierRange mkRange(Symbol symbol, Type type) {
        return new QuantifierRange(symbol, type, mkTypeDomain(type));
    }

    /** Returns a range binding the identifier's symbol over its type. */
    public static QuantifierRange mkRange(Identifier id) {
        return mkRange(id.getSymbol(), id.getType());
    }

    public static QuantifierExpression mkForall(List<QuantifierRange> ranges,
            Expression body) {
        return new QuantifierExpression(QuantifierExpression.Kind.FORALL,
                ranges, body);
    }

    public static QuantifierExpression mkExists(List<QuantifierRange> ranges,
            Expression body) {
        return new QuantifierExpression(QuantifierExpression.Kind.EXISTS,
                ranges, body);
    }

    /** Returns {@code forall id: body} over the identifier's type. */
    public static QuantifierExpression mkForall(Identifier id,
            Expression body) {
        return mkForall(Collections.singletonList(mkRange(id)), body);
    }

    /** Returns {@code exists id: body} over the identifier's type. */
    public static QuantifierExpression mkExists(Identifier id,
            Expression body) {
        return mkExists(Collections.singletonList(mkRange(id)), body);
    }

    /** Returns a quantifier of the given kind. */
    public static QuantifierExpression mkQuantifier(
            QuantifierExpression.Kind kind, List<QuantifierRange> ranges,
            List<List<Expression>> triggers, Expression condition,
            Expression body) {
        return new QuantifierExpression(kind, ranges, triggers, condition,
                body);
    }

    /**
    * Returns the left-nested conjunction of the given expressions without
    * simplification, or {@code true} for an empty list.
    */
    public static Expression mkConjunction(List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            return mkBool(true);
        }
        Expression ret = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            ret = mkAnd(ret, conjuncts.get(i));
        }
        return ret;
    }

    /** Returns a fresh mutable list with the given expressions. */
    public static List<Expression> list(Expression... exprs) {
        return new ArrayList<Expression>(Arrays.asList(exprs));
    }

}
