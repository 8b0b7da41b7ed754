package vcsimp.hir;

import java.io.PrintWriter;

/**
* A reference to a numbered temporary slot of the function the condition was
* generated from. Temporaries are never bound by quantifiers.
*/
public class Temporary extends Expression {

    private final int index;

    public Temporary(int index, Type type) {
        super(type);
        if (index < 0) {
            throw new IllegalArgumentException("negative temporary " + index);
        }
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public void print(PrintWriter o) {
        o.print("$t" + index);
    }

    @Override
    protected boolean equalsNode(Expression other) {
        return index == ((Temporary)other).index;
    }

    @Override
    protected int hashNode() {
        return index;
    }

}
