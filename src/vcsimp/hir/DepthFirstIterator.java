package vcsimp.hir;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Pre-order walk over a tree of Traversable nodes, driven by an explicit
* stack so deep conjunction chains do not exhaust the call stack. Binders
* are not interpreted: the domains, triggers, condition and body of a
* quantifier are all visited.
*/
public class DepthFirstIterator<E extends Traversable> implements Iterator<E> {

    private final List<Traversable> stack;

    public DepthFirstIterator(Traversable root) {
        stack = new ArrayList<Traversable>();
        stack.add(root);
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException("tree exhausted");
        }
        Traversable node = stack.remove(stack.size() - 1);
        List<? extends Traversable> children = node.getChildren();
        // reverse push, leftmost child on top
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.add(children.get(i));
        }
        return (E)node;
    }

    public void remove() {
        throw new UnsupportedOperationException("expression trees are immutable");
    }
}
