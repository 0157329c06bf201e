package lambda.hir;

/**
* The closed set of node kinds. Each kind corresponds to exactly one language
* interface and one {@code visit} method of {@link TraversableVisitor}; adding
* a kind means extending this enumeration, the visitor interface, and every
* visitor implementing it together.
*/
public enum NodeKind {

    PROGRAM(Program.class),

    // Terms
    VARIABLE(Variable.class),
    ABSTRACTION(Abstraction.class),
    APPLICATION(Application.class),

    // Statements
    DEFINITION(Definition.class),
    EVALUATION(Evaluation.class);

    private final Class<? extends Node> type;

    NodeKind(Class<? extends Node> type) {
        this.type = type;
    }

    /**
    * Returns the language interface implemented by nodes of this kind.
    */
    public Class<? extends Node> getType() {
        return type;
    }

    /**
    * Checks if nodes of this kind can be viewed as the given language
    * interface or category, e.g. {@code VARIABLE.conformsTo(Term.class)}.
    *
    * @param target a language interface, a category, or {@link Node}.
    * @return true if the target is a supertype of this kind's interface.
    */
    public boolean conformsTo(Class<?> target) {
        return target.isAssignableFrom(type);
    }

    public boolean isTerm() {
        return conformsTo(Term.class);
    }

    public boolean isStatement() {
        return conformsTo(Statement.class);
    }
}
