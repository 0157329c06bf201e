package lambda.hir;

/**
* A node introducing a name: an {@link Abstraction} binds its variable in its
* body, a {@link Definition} binds its variable in the rest of the program.
* The bound variable is a binding occurrence, not a use of the name.
*/
public interface Binder extends Node {

    /** Returns the variable being bound. */
    Variable getVariable();
}
