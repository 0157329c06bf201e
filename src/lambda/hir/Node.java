package lambda.hir;

import java.util.List;

/**
* Common interface of every element of the abstract syntax tree. A node has
* a kind, a source location, an ordered list of children it owns, and an
* {@code accept} method that dispatches to the {@link TraversableVisitor}
* method for its concrete kind.
*
* <p>
* A node is owned by at most one parent. The children of a node are fixed at
* construction, except that {@link MultiNode} may append new ones. Nodes are
* not thread-safe; a tree may be handed to another thread as a whole but must
* not be appended to from two threads at once.
* </p>
*/
public interface Node extends Cloneable {

    /**
    * Returns the kind of this node. The kind never changes.
    */
    NodeKind getKind();

    /**
    * Returns the source position of this node, {@link Location#UNKNOWN} if
    * none has been recorded.
    */
    Location getLocation();

    /**
    * Records the source position of a node built before its position was
    * known. The location can be set only once.
    *
    * @param location the position; must not be null.
    * @throws IllegalArgumentException if {@code location} is null.
    * @throws IllegalStateException if a location was already recorded.
    */
    void setLocation(Location location);

    /**
    * Returns a read-only list of the direct children in order. The list is
    * empty for nullary nodes and has exactly one or two elements for unary
    * and binary nodes.
    */
    List<Node> getChildren();

    /**
    * Returns the node owning this one, or null for the root of a tree.
    */
    Node getParent();

    /**
    * Calls the {@code visit} method of {@code v} matching the kind of this
    * node.
    */
    void accept(TraversableVisitor v);

    /**
    * Returns a deep copy of the subtree rooted at this node. The copy has no
    * parent; symbols are shared, locations are copied.
    */
    Node clone();
}
