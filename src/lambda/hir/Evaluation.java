package lambda.hir;

/**
* A request to evaluate a term.
*/
public interface Evaluation extends Statement {

    Term getTerm();
}
