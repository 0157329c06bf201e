package lambda.hir;

import java.util.List;

/**
* The root of a translation unit: a sequence of statements in source order.
*/
public interface Program extends Node {

    /**
    * Appends a statement to the end of the program.
    *
    * @throws IllegalArgumentException if {@code stmt} is null.
    * @throws NotAnOrphanException if {@code stmt} already has a parent.
    */
    void addStatement(Statement stmt);

    /**
    * Returns a read-only view of the statements in the order they were
    * added.
    */
    List<Statement> getStatements();
}
