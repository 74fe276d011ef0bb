package net.ox.ast;

/**
 * Thrown when an AST type descriptor or hierarchy is malformed (e.g. children fields
 * that are not contiguous, templates naming unknown fields, or a type
 * registered in more than one hierarchy).
 */
public class DeclarationException extends AstException {

    public DeclarationException() {
        super();
    }
    public DeclarationException(String message) {
        super(message);
    }
    public DeclarationException(Throwable cause) {
        super(cause);
    }
    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }

}
