package lambda.hir;

/**
* Applies a function term to an argument term.
*/
public interface Application extends Term {

    Term getFunction();

    Term getArgument();
}
