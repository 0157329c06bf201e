package lambda.hir;

/**
* Thrown when a node that already has a parent is attached to another parent.
* A node may be owned by at most one parent at a time; callers must clone the
* node or build a fresh one instead.
*/
public class NotAnOrphanException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public NotAnOrphanException() {
        super();
    }

    public NotAnOrphanException(String message) {
        super(message);
    }
}
