package lambda.hir;

import java.util.List;

public class ProgramNode extends MultiNode<Statement> implements Program {

    /** Creates an empty program. */
    public ProgramNode() {
        super(NodeKind.PROGRAM);
    }

    /**
    * Creates a program holding the given statements in list order.
    *
    * @throws IllegalArgumentException if an element is null.
    * @throws NotAnOrphanException if an element has a parent.
    */
    public ProgramNode(List<? extends Statement> statements) {
        super(NodeKind.PROGRAM, statements);
    }

    @Override
    public void addStatement(Statement stmt) {
        addNode(stmt);
    }

    @Override
    public List<Statement> getStatements() {
        return getNodes();
    }

    @Override
    public ProgramNode clone() {
        return (ProgramNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
