package lambda.hir;

public class DefinitionNode extends BinaryNode<Variable, Term>
                            implements Definition {

    /**
    * @param var the defined name.
    * @param def the term bound to it.
    * @throws IllegalArgumentException if an argument is null.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public DefinitionNode(Variable var, Term def) {
        super(NodeKind.DEFINITION, var, def);
    }

    @Override
    public Variable getVariable() {
        return getFirst();
    }

    @Override
    public Term getDefinition() {
        return getSecond();
    }

    @Override
    public DefinitionNode clone() {
        return (DefinitionNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
