package lambda.hir;

/**
* An expression of the untyped lambda calculus: a variable, an abstraction,
* or an application.
*/
public interface Term extends Node {
}
