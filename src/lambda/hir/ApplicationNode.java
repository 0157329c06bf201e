package lambda.hir;

public class ApplicationNode extends BinaryNode<Term, Term>
                             implements Application {

    /**
    * @param func the applied function.
    * @param arg the argument.
    * @throws IllegalArgumentException if an argument is null.
    * @throws NotAnOrphanException if an argument has a parent, or
    * {@code func} and {@code arg} are the same node.
    */
    public ApplicationNode(Term func, Term arg) {
        super(NodeKind.APPLICATION, func, arg);
    }

    @Override
    public Term getFunction() {
        return getFirst();
    }

    @Override
    public Term getArgument() {
        return getSecond();
    }

    @Override
    public ApplicationNode clone() {
        return (ApplicationNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
