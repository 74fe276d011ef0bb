package net.ox.ast;

/**
 * Thrown when an AST element that already has a parent is attached to another
 * parent (or twice to the same one).
 */
public class OwnershipException extends AstException {

    public OwnershipException() {
        super();
    }
    public OwnershipException(String message) {
        super(message);
    }
    public OwnershipException(Throwable cause) {
        super(cause);
    }
    public OwnershipException(String message, Throwable cause) {
        super(message, cause);
    }

}
