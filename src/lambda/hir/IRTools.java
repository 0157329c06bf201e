package lambda.hir;

import java.util.EnumMap;
import java.util.Map;

/**
* Queries on nodes and trees: kind-checked downcasts and ancestor searches.
* None of the methods modify the tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Returns {@code node} typed as {@code target} if the node is one,
    * otherwise null. This is the way to narrow a node whose kind is not known
    * statically, e.g. while walking children generically. Language
    * interfaces and categories are answered from the kind; implementation
    * and shape classes ({@link ApplicationNode}, {@link BinaryNode}, ...)
    * from the node's class.
    *
    * @param target a language interface ({@link Variable}, {@link Program},
    * ...), a category ({@link Term}, {@link Statement}), {@link Node}, or a
    * node class.
    * @param node the node to narrow; may be null.
    * @return the same node as a {@code T}, or null if it does not conform or
    * is null.
    */
    public static <T extends Node> T as(Class<T> target, Node node) {
        if (!is(target, node)) {
            return null;
        }
        return target.cast(node);
    }

    /**
    * Checks if {@link #as(Class, Node)} would return a node.
    */
    public static boolean is(Class<? extends Node> target, Node node) {
        if (node == null) {
            return false;
        }
        return node.getKind().conformsTo(target) || target.isInstance(node);
    }

    /**
    * Returns the closest proper ancestor of {@code node} whose kind conforms
    * to {@code type}, or null if there is none.
    */
    public static <T extends Node> T getAncestorOfType(Node node,
                                                       Class<T> type) {
        Node t = node.getParent();
        while (t != null && !t.getKind().conformsTo(type)) {
            t = t.getParent();
        }
        return (t == null) ? null : type.cast(t);
    }

    /**
    * Checks if {@code anc} is a proper ancestor of {@code node}.
    */
    public static boolean isAncestorOf(Node anc, Node node) {
        for (Node t = node.getParent(); t != null; t = t.getParent()) {
            if (t == anc) {
                return true;
            }
        }
        return false;
    }

    /**
    * Returns the root of the tree containing {@code node}.
    */
    public static Node getRoot(Node node) {
        Node t = node;
        while (t.getParent() != null) {
            t = t.getParent();
        }
        return t;
    }

    /**
    * Counts the nodes of each kind in the subtree rooted at {@code root}.
    *
    * @return a map holding an entry for every kind present.
    */
    public static Map<NodeKind, Integer> countKinds(Node root) {
        Map<NodeKind, Integer> counts =
                new EnumMap<NodeKind, Integer>(NodeKind.class);
        DepthFirstIterator<Node> iter = new DepthFirstIterator<Node>(root);
        while (iter.hasNext()) {
            NodeKind kind = iter.next().getKind();
            Integer n = counts.get(kind);
            counts.put(kind, (n == null) ? 1 : n + 1);
        }
        return counts;
    }
}
