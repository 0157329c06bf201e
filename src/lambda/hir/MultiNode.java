package lambda.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
* Base class of nodes holding an ordered sequence of children of one language
* interface. Children are only ever appended; the order of the existing
* children never changes.
*
* @param <T> the language interface of the children.
*/
public abstract class MultiNode<T extends Node> extends AbstractNode {

    private List<T> nodes;

    private List<T> nodes_view;

    protected MultiNode(NodeKind kind) {
        super(kind);
        setNodes(new ArrayList<T>(4));
    }

    /**
    * Creates a node owning the given children in list order. All elements
    * are checked before any is adopted, so a rejected list leaves every
    * element as it was.
    *
    * @throws IllegalArgumentException if an element is null.
    * @throws NotAnOrphanException if an element has a parent or appears
    * twice.
    */
    protected MultiNode(NodeKind kind, List<? extends T> children) {
        super(kind);
        Map<T, Boolean> seen = new IdentityHashMap<T, Boolean>();
        for (int i = 0; i < children.size(); i++) {
            T child = children.get(i);
            checkChild(child);
            if (seen.put(child, Boolean.TRUE) != null) {
                throw new NotAnOrphanException(
                        child.getKind() + " appears twice under " + kind);
            }
        }
        setNodes(new ArrayList<T>(children.size()));
        for (int i = 0; i < children.size(); i++) {
            nodes.add(adopt(children.get(i)));
        }
    }

    private void setNodes(List<T> nodes) {
        this.nodes = nodes;
        this.nodes_view = Collections.unmodifiableList(nodes);
    }

    /**
    * Appends a child.
    *
    * @param node the new last child.
    * @throws IllegalArgumentException if {@code node} is null or is this
    * node or one of its ancestors.
    * @throws NotAnOrphanException if {@code node} has a parent.
    */
    public void addNode(T node) {
        checkChild(node);
        nodes.add(adopt(node));
    }

    /**
    * Returns a read-only view of the children. The view reflects later
    * appends.
    */
    public List<T> getNodes() {
        return nodes_view;
    }

    public int size() {
        return nodes.size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Node> getChildren() {
        return (List<Node>)(List<?>)nodes_view;
    }

    @Override
    @SuppressWarnings("unchecked")
    public MultiNode<T> clone() {
        MultiNode<T> o = (MultiNode<T>)super.clone();
        o.setNodes(new ArrayList<T>(nodes.size()));
        for (int i = 0; i < nodes.size(); i++) {
            o.nodes.add(o.adoptClone(nodes.get(i)));
        }
        return o;
    }
}
