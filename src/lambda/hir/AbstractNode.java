package lambda.hir;

/**
* Base class of all node implementations. It holds the kind, location and
* parent link, and enforces the ownership rules when children are attached:
* a child must be non-null, have no parent, and must not be the new parent or
* one of its ancestors. The arity shapes decide how children are stored.
*/
public abstract class AbstractNode implements Node {

    private final NodeKind kind;

    private Location location;

    /** The parent object of this node */
    private AbstractNode parent;

    /**
    * Constructor for derived classes.
    *
    * @param kind the kind of the concrete node.
    * @throws IllegalArgumentException if {@code kind} is null or this node
    * does not implement the language interface of {@code kind}.
    */
    protected AbstractNode(NodeKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("node kind is required");
        }
        if (!kind.getType().isInstance(this)) {
            throw new IllegalArgumentException(getClass().getName()
                    + " is not a " + kind.getType().getSimpleName());
        }
        this.kind = kind;
        this.location = Location.UNKNOWN;
        this.parent = null;
    }

    @Override
    public final NodeKind getKind() {
        return kind;
    }

    @Override
    public Location getLocation() {
        return location;
    }

    @Override
    public void setLocation(Location location) {
        if (location == null) {
            throw new IllegalArgumentException("location must not be null");
        }
        if (this.location.isKnown()) {
            throw new IllegalStateException(
                    kind + " already located at " + this.location);
        }
        this.location = location;
    }

    @Override
    public Node getParent() {
        return parent;
    }

    /**
    * Checks that {@code child} may become a child of this node.
    *
    * @throws IllegalArgumentException if {@code child} is null, is not
    * derived from this class, or is this node or one of its ancestors.
    * @throws NotAnOrphanException if {@code child} has a parent.
    */
    protected void checkChild(Node child) {
        if (child == null) {
            throw new IllegalArgumentException(
                    kind + " cannot have a null child");
        }
        if (!(child instanceof AbstractNode)) {
            throw new IllegalArgumentException(
                    "foreign node type " + child.getClass().getName());
        }
        if (child.getParent() != null) {
            throw new NotAnOrphanException(child.getKind() + " under " + kind);
        }
        for (Node t = this; t != null; t = t.getParent()) {
            if (t == child) {
                throw new IllegalArgumentException(
                        child.getKind() + " cannot be its own descendant");
            }
        }
    }

    /**
    * Makes this node the parent of a child that passed
    * {@link #checkChild(Node)}.
    *
    * @return the child.
    */
    protected <T extends Node> T adopt(T child) {
        ((AbstractNode)child).parent = this;
        return child;
    }

    /**
    * Returns a copy of this node with no parent. Subclasses replace the
    * copied child references with clones of the children.
    */
    @Override
    public AbstractNode clone() {
        AbstractNode o = null;
        try {
            o = (AbstractNode)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        return o;
    }

    /**
    * Clones a child of the node being copied and attaches the copy to this
    * node.
    */
    @SuppressWarnings("unchecked")
    protected <T extends Node> T adoptClone(T child) {
        return adopt((T)child.clone());
    }

    @Override
    public String toString() {
        String name = kind.getType().getSimpleName();
        if (location.isKnown()) {
            return name + " at " + location;
        }
        return name;
    }
}
