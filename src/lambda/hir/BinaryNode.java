package lambda.hir;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* Base class of nodes with exactly two children. The children are accessible
* positionally with {@link #getFirst()} and {@link #getSecond()}, or as the
* operands {@link #getLeft()} and {@link #getRight()}; both pairs return the
* same nodes.
*
* @param <L> the language interface of the first child.
* @param <R> the language interface of the second child.
*/
public abstract class BinaryNode<L extends Node, R extends Node>
                                 extends AbstractNode {

    private L left;

    private R right;

    private List<Node> children;

    /**
    * @param kind the kind of the concrete node.
    * @param left the first child; must not be null.
    * @param right the second child; must not be null.
    * @throws IllegalArgumentException if a child is null.
    * @throws NotAnOrphanException if a child has a parent, or both
    * arguments are the same node.
    */
    protected BinaryNode(NodeKind kind, L left, R right) {
        super(kind);
        checkChild(left);
        checkChild(right);
        if (left == right) {
            throw new NotAnOrphanException(
                    kind + " cannot own the same node twice");
        }
        setChildren(adopt(left), adopt(right));
    }

    private void setChildren(L left, R right) {
        this.left = left;
        this.right = right;
        this.children = Collections.unmodifiableList(
                Arrays.<Node>asList(left, right));
    }

    public L getLeft() {
        return left;
    }

    public R getRight() {
        return right;
    }

    public L getFirst() {
        return left;
    }

    public R getSecond() {
        return right;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    @SuppressWarnings("unchecked")
    public BinaryNode<L, R> clone() {
        BinaryNode<L, R> o = (BinaryNode<L, R>)super.clone();
        o.setChildren(o.adoptClone(left), o.adoptClone(right));
        return o;
    }
}
