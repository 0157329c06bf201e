package lambda.hir;

/**
* Factory for the nodes of one translation unit. The unit owns the symbol
* table the variables are interned in, so every variable of the same name
* built by one unit refers to the same {@link Symbol}.
*
* <p>
* Each factory method has a variant taking the source location of the new
* node. Passing {@link Location#UNKNOWN} leaves the location to be set later.
* </p>
*/
public class Unit {

    private final String name;

    private final SymbolTable symbols;

    /**
    * Creates a unit with its own symbol table.
    *
    * @param name the source name, used in status messages; may be null.
    */
    public Unit(String name) {
        this(name, new SymbolTable());
    }

    /**
    * Creates a unit interning names in a shared symbol table.
    */
    public Unit(String name, SymbolTable symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("symbol table is required");
        }
        this.name = name;
        this.symbols = symbols;
        PrintTools.printlnStatus(2, "[Unit]", "created", this);
    }

    public String getName() {
        return name;
    }

    public SymbolTable getSymbolTable() {
        return symbols;
    }

    public Variable makeVariable(String spelling) {
        return makeVariable(spelling, Location.UNKNOWN);
    }

    public Variable makeVariable(String spelling, Location loc) {
        return located(new VariableNode(symbols.intern(spelling)), loc);
    }

    public Abstraction makeAbstraction(Variable var, Term term) {
        return makeAbstraction(var, term, Location.UNKNOWN);
    }

    public Abstraction makeAbstraction(Variable var, Term term,
                                       Location loc) {
        return located(new AbstractionNode(var, term), loc);
    }

    public Application makeApplication(Term func, Term arg) {
        return makeApplication(func, arg, Location.UNKNOWN);
    }

    public Application makeApplication(Term func, Term arg, Location loc) {
        return located(new ApplicationNode(func, arg), loc);
    }

    public Definition makeDefinition(Variable var, Term def) {
        return makeDefinition(var, def, Location.UNKNOWN);
    }

    public Definition makeDefinition(Variable var, Term def, Location loc) {
        return located(new DefinitionNode(var, def), loc);
    }

    public Evaluation makeEvaluation(Term term) {
        return makeEvaluation(term, Location.UNKNOWN);
    }

    public Evaluation makeEvaluation(Term term, Location loc) {
        return located(new EvaluationNode(term), loc);
    }

    public Program makeProgram() {
        return makeProgram(Location.UNKNOWN);
    }

    public Program makeProgram(Location loc) {
        return located(new ProgramNode(), loc);
    }

    private <T extends Node> T located(T node, Location loc) {
        if (loc == null) {
            throw new IllegalArgumentException("location must not be null");
        }
        if (loc.isKnown()) {
            node.setLocation(loc);
        }
        PrintTools.printlnStatus(3, "[Unit]", "made", node);
        return node;
    }

    @Override
    public String toString() {
        return (name == null) ? "<anonymous>" : name;
    }
}
