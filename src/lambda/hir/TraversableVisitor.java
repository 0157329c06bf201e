package lambda.hir;

/**
* Visitor pattern visitor interface for the {@link Node} hierarchy.
*
* <p>
* For every kind in {@link NodeKind} there is one {@code visit} method here
* whose only argument is that kind's language interface. Each concrete node
* class directly implements (not inherits) an {@code accept} method that
* simply calls {@code v.visit(this)}, so the node's class selects the method
* without a type switch in the visitor.
* </p>
*
* <p>
* The set of methods must stay in step with {@link NodeKind}: a new kind
* needs a new method here and a handler in every implementation, and the
* compiler reports the implementations that were missed.
* </p>
*
* @see Visitor
*/
public interface TraversableVisitor {
  public void visit(Program node);
  // Statement
    public void visit(Definition node);
    public void visit(Evaluation node);
  // Term
    public void visit(Variable node);
    public void visit(Abstraction node);
    public void visit(Application node);
}
