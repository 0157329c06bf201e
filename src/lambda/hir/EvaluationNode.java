package lambda.hir;

public class EvaluationNode extends UnaryNode<Term> implements Evaluation {

    /**
    * @param term the term to evaluate.
    * @throws IllegalArgumentException if {@code term} is null.
    * @throws NotAnOrphanException if {@code term} has a parent.
    */
    public EvaluationNode(Term term) {
        super(NodeKind.EVALUATION, term);
    }

    @Override
    public Term getTerm() {
        return getFirst();
    }

    @Override
    public EvaluationNode clone() {
        return (EvaluationNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
