package lambda.hir;

import lambda.exec.Config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
* Iterates over the nodes of a tree in depth-first order.
*
* <p>
* The iteration starts from the root node that was specified in the
* constructor. By default, all nodes are returned before their children
* (pre-order); {@link #setDefaultOrderToPost()} returns children first.
* Children are returned in the order of {@link Node#getChildren()}.
* </p>
*
* <p>
* If {@code trace-traversal} is set in {@code lambda.cfg}, or the verbosity
* is at least 4, every node is reported on stderr as it is returned.
* </p>
*/
public class DepthFirstIterator<E extends Node> implements Iterator<E> {

    private final Node root;

    private final List<Node> stack;

    // For each node in stack, whether its children have already been pushed,
    // which can only happen in post-order.
    private final List<Boolean> stack_post;

    private final List<Class<? extends Node>> prune_list;

    private boolean default_order_is_post = false;

    private final boolean trace;

    /**
    * Creates a new iterator starting at the specified node.
    *
    * @param init the first node to visit; must not be null.
    */
    public DepthFirstIterator(Node init) {
        if (init == null) {
            throw new IllegalArgumentException("iteration root is null");
        }
        root = init;
        stack = new ArrayList<Node>();
        stack_post = new ArrayList<Boolean>();
        prune_list = new ArrayList<Class<? extends Node>>(4);
        trace = Config.getConfig().isTraversalTraced()
                || PrintTools.getVerbosity() >= 4;
        reset();
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        while (true) {
            int top = stack.size() - 1;
            Node t = stack.remove(top);
            boolean expanded = stack_post.remove(top);
            if (expanded || !default_order_is_post || !hasVisibleChildren(t)) {
                if (!default_order_is_post) {
                    pushChildren(t);
                }
                if (trace) {
                    PrintTools.printlnStatus(0, "visit",
                            (default_order_is_post ? "post:" : "pre :"), t);
                }
                return (E)t;
            }
            // Revisit t once its children are done.
            stack.add(t);
            stack_post.add(true);
            pushChildren(t);
        }
    }

    /**
    * This operation is not supported.
    * @throws UnsupportedOperationException always
    */
    public void remove() {
        throw new UnsupportedOperationException(
                "nodes cannot be removed from a tree");
    }

    private boolean hasVisibleChildren(Node t) {
        return !t.getChildren().isEmpty() && !needsPruning(t.getClass());
    }

    private void pushChildren(Node t) {
        if (needsPruning(t.getClass())) {
            return;
        }
        List<Node> children = t.getChildren();
        // Push in reverse so the first child is on top of the stack.
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.add(children.get(i));
            stack_post.add(false);
        }
    }

    private boolean needsPruning(Class<? extends Node> c) {
        for (int i = 0; i < prune_list.size(); i++) {
            if (prune_list.get(i).isAssignableFrom(c)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Disables traversal into nodes of the specified type. For example, if
    * traversal reaches a node of type <b>c</b>, the node is returned but its
    * children are not visited.
    *
    * @param c the node type to be pruned on.
    */
    public void pruneOn(Class<? extends Node> c) {
        prune_list.add(c);
    }

    /**
    * Sets the traversal order to post-order. Must be called before the first
    * call to {@link #next()} or after {@link #reset()}.
    */
    public void setDefaultOrderToPost() {
        default_order_is_post = true;
    }

    /**
    * Returns the remaining nodes that are instances of <b>c</b>, in
    * iteration order.
    *
    * @param c the node type to be collected.
    * @return the collected list.
    */
    public <T extends Node> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Node o = next();
            if (c.isInstance(o)) {
                ret.add(c.cast(o));
            }
        }
        return ret;
    }

    /**
    * Returns the set of remaining nodes that are instances of <b>c</b>.
    *
    * @param c the node type to be collected.
    * @return the collected set.
    */
    public <T extends Node> Set<T> getSet(Class<T> c) {
        Set<T> set = new HashSet<T>();
        while (hasNext()) {
            Node o = next();
            if (c.isInstance(o)) {
                set.add(c.cast(o));
            }
        }
        return set;
    }

    /**
    * Resets the iterator by setting the current position to the root node.
    * Pruned types and the traversal order are kept.
    */
    public void reset() {
        stack.clear();
        stack_post.clear();
        stack.add(root);
        stack_post.add(false);
    }

    /**
    * Unlike {@link #reset()}, also clears the pruned types and sets the
    * traversal order back to pre-order.
    */
    public void clear() {
        reset();
        prune_list.clear();
        default_order_is_post = false;
    }
}
