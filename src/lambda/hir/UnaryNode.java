package lambda.hir;

import java.util.Collections;
import java.util.List;

/**
* Base class of nodes with exactly one child, accessible with
* {@link #getChild()} or {@link #getFirst()}.
*
* @param <C> the language interface of the child.
*/
public abstract class UnaryNode<C extends Node> extends AbstractNode {

    private C child;

    private List<Node> children;

    /**
    * @param kind the kind of the concrete node.
    * @param child the only child; must not be null.
    * @throws IllegalArgumentException if {@code child} is null.
    * @throws NotAnOrphanException if {@code child} has a parent.
    */
    protected UnaryNode(NodeKind kind, C child) {
        super(kind);
        checkChild(child);
        setChildren(adopt(child));
    }

    private void setChildren(C child) {
        this.child = child;
        this.children = Collections.<Node>singletonList(child);
    }

    public C getChild() {
        return child;
    }

    public C getFirst() {
        return child;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    @SuppressWarnings("unchecked")
    public UnaryNode<C> clone() {
        UnaryNode<C> o = (UnaryNode<C>)super.clone();
        o.setChildren(o.adoptClone(child));
        return o;
    }
}
