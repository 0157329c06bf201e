package lambda.hir;

import java.util.Collections;
import java.util.List;

/**
* Base class of nodes without children. All nullary nodes share one empty,
* immutable child list so leaves can be walked like any other node.
*/
public abstract class NullaryNode extends AbstractNode {

    /** Empty child list for nodes having no children */
    protected static final List<Node> empty_list = Collections.emptyList();

    protected NullaryNode(NodeKind kind) {
        super(kind);
    }

    @Override
    public List<Node> getChildren() {
        return empty_list;
    }

    @Override
    public NullaryNode clone() {
        return (NullaryNode)super.clone();
    }
}
