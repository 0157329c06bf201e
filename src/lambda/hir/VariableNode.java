package lambda.hir;

/**
* Leaf node naming a variable. The symbol is shared with the symbol table
* and with every other variable of the same name.
*/
public class VariableNode extends NullaryNode implements Variable {

    private final Symbol symbol;

    /**
    * @param symbol the interned name; must not be null.
    */
    public VariableNode(Symbol symbol) {
        super(NodeKind.VARIABLE);
        if (symbol == null) {
            throw new IllegalArgumentException("variable without a symbol");
        }
        this.symbol = symbol;
    }

    @Override
    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    public String getName() {
        return symbol.getSpelling();
    }

    @Override
    public VariableNode clone() {
        return (VariableNode)super.clone();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }

    @Override
    public String toString() {
        return symbol.getSpelling();
    }
}
