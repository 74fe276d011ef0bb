package net.ox.ast;

/**
 * Generic superclass for (unchecked) errors raised while declaring,
 * constructing, or converting AST elements.
 */
public class AstException extends RuntimeException {

    public AstException() {
        super();
    }
    public AstException(String message) {
        super(message);
    }
    public AstException(Throwable cause) {
        super(cause);
    }
    public AstException(String message, Throwable cause) {
        super(message, cause);
    }

}
