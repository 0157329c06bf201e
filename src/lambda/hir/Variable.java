package lambda.hir;

/**
* A term referring to a name in the environment.
*/
public interface Variable extends Term {

    /** Returns the interned name; the node does not own it. */
    Symbol getSymbol();

    /** Returns the spelling of the name. */
    String getName();
}
