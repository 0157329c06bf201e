package lambda.hir;

/**
* A lambda expression binding {@link #getVariable()} in {@link #getTerm()}.
*/
public interface Abstraction extends Term, Binder {

    Variable getVariable();

    Term getTerm();
}
