package lambda.hir;

import java.util.List;

/**
* Visitor that walks the whole tree in pre-order by default. Each kind's
* {@code visit} method forwards to the method for its category
* ({@link #visitStatement(Statement)} or {@link #visitTerm(Term)}), and the
* category methods forward to {@link #visitNode(Node)}, which visits the
* children in order.
*
* <p>
* The variable of a {@link Binder} (the parameter of an abstraction, the name
* of a definition) is a binding occurrence. The walk hands it to
* {@link #visitBinding(Variable)} instead of dispatching it, so
* {@link #visit(Variable)} sees exactly the uses of names. Override
* {@code visitBinding} with {@code var.accept(this)} to treat both alike.
* </p>
*
* <p>
* Overriding a method replaces the behavior for that kind or category only.
* An override that still wants to descend must call {@link #visitNode(Node)}
* (or the super method) itself. For example, a visitor that only counts
* applications:
* </p>
*
* <pre>
* class Counter extends Visitor {
*     int count;
*     public void visit(Application node) {
*         count++;
*         visitNode(node);
*     }
* }
* </pre>
*
* <p>
* The walk does not guard against cycles; trees built through the node
* constructors cannot have any.
* </p>
*/
public class Visitor implements TraversableVisitor {

    /**
    * Visits the children of {@code node} in order: the statements of a
    * program as they were added, the first then the second child of a
    * binary node.
    */
    public void visitNode(Node node) {
        Binder binder = IRTools.as(Binder.class, node);
        List<Node> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (binder != null && child == binder.getVariable()) {
                visitBinding(binder.getVariable());
            } else {
                child.accept(this);
            }
        }
    }

    /**
    * Called for the variable bound by an abstraction or a definition. Does
    * nothing by default.
    */
    public void visitBinding(Variable var) {
    }

    public void visit(Program node) {
        visitNode(node);
    }

    /** Default handler for all statements. */
    public void visitStatement(Statement node) {
        visitNode(node);
    }

    public void visit(Definition node) {
        visitStatement(node);
    }

    public void visit(Evaluation node) {
        visitStatement(node);
    }

    /** Default handler for all terms. */
    public void visitTerm(Term node) {
        visitNode(node);
    }

    public void visit(Variable node) {
        visitTerm(node);
    }

    public void visit(Abstraction node) {
        visitTerm(node);
    }

    public void visit(Application node) {
        visitTerm(node);
    }
}
