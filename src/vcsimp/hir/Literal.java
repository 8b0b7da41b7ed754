package vcsimp.hir;

/** Base class for constant values. */
public abstract class Literal extends Expression {

    protected Literal(Type type) {
        super(type);
    }

}
