package lambda.hir;

public class AbstractionNode extends BinaryNode<Variable, Term>
                             implements Abstraction {

    /**
    * @param var the bound variable.
    * @param term the body.
    * @throws IllegalArgumentException if an argument is null.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public AbstractionNode(Variable var, Term term) {
        super(NodeKind.ABSTRACTION, var, term);
    }

    @Override
    public Variable getVariable() {
        return getFirst();
    }

    @Override
    public Term getTerm() {
        return getSecond();
    }

    @Override
    public AbstractionNode clone() {
        return (AbstractionNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
