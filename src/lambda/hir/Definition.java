package lambda.hir;

/**
* Associates a variable with a term for the rest of the program.
*/
public interface Definition extends Statement, Binder {

    Variable getVariable();

    Term getDefinition();
}
