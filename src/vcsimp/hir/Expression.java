package vcsimp.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions. Expressions are immutable: rewriting
* produces new nodes and shares unchanged sub-trees. Equality is structural
* and ignores the attached types, so two trees that print the same are equal
* even if they were typed by different producers.
*/
public abstract class Expression implements Traversable {

    /** The type assigned by the producer of the node */
    protected final Type type;

    /** All children are expressions; the list is unmodifiable. */
    protected final List<Expression> children;

    /** Empty child list for expressions having no children */
    protected static final List<Expression> empty_list =
            Collections.unmodifiableList(new ArrayList<Expression>(0));

    /** Cached hash code, computed on first use. */
    private int hash;

    /**
    * Constructor for leaf expressions.
    *
    * @param type The type of the expression.
    */
    protected Expression(Type type) {
        this(type, empty_list);
    }

    /**
    * Constructor for derived classes with children.
    *
    * @param type The type of the expression.
    * @param children The children; copied into an unmodifiable list.
    * @throws IllegalArgumentException if the type or a child is null.
    */
    protected Expression(Type type, List<Expression> children) {
        if (type == null) {
            throw new IllegalArgumentException("expression without a type");
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == null) {
                throw new IllegalArgumentException("null child at " + i);
            }
        }
        this.type = type;
        if (children.isEmpty()) {
            this.children = empty_list;
        } else {
            this.children = Collections.unmodifiableList(
                    new ArrayList<Expression>(children));
        }
    }

    /** Returns the type of this expression. */
    public Type getType() {
        return type;
    }

    public List<Expression> getChildren() {
        return children;
    }

    /**
    * Compares the node-specific data of two expressions of the same class,
    * excluding children and types.
    *
    * @param other an expression of the same class as this one.
    * @return true if the node data is equal.
    */
    protected abstract boolean equalsNode(Expression other);

    /** Returns the hash of the node-specific data. */
    protected abstract int hashNode();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        Expression other = (Expression)o;
        if (hashCode() != other.hashCode()) {
            return false;
        }
        return equalsNode(other) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = 31 * getClass().getName().hashCode() + hashNode();
            for (int i = 0; i < children.size(); i++) {
                h = 31 * h + children.get(i).hashCode();
            }
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    /** Returns the printed form of the expression. */
    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
