package lambda.hir;

/**
* A top-level construct of a program. Statements are kept apart from terms
* since they only manipulate the context: a definition binds a name, an
* evaluation asks for the value of a term.
*/
public interface Statement extends Node {
}
