package net.ox.ast;

/**
 * Thrown when a node or leaf is constructed with the wrong amount of arguments or
 * with an argument of the wrong type; the message names the offending field.
 */
public class ConstructionException extends AstException {

    public ConstructionException() {
        super();
    }
    public ConstructionException(String message) {
        super(message);
    }
    public ConstructionException(Throwable cause) {
        super(cause);
    }
    public ConstructionException(String message, Throwable cause) {
        super(message, cause);
    }

}
