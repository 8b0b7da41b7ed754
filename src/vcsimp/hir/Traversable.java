package vcsimp.hir;

import java.util.List;

/**
* Any class implementing this interface can act as a tree node by providing
* access to its children. Expression trees are immutable and shared, so
* there is no parent link: the same sub-tree may hang below many parents.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as an unmodifiable list.
    * The ordering of children is fixed per node kind but callers should
    * prefer the accessors of the concrete class.
    *
    * @return the children as a list.
    */
    List<? extends Traversable> getChildren();

}
