package net.ox.ast;

/**
 * Thrown when an S-expression head is neither registered in a hierarchy's symbol
 * table nor a constructor itself.
 */
public class InvalidHeadException extends ConstructionException {

    public InvalidHeadException() {
        super();
    }
    public InvalidHeadException(String message) {
        super(message);
    }
    public InvalidHeadException(Throwable cause) {
        super(cause);
    }
    public InvalidHeadException(String message, Throwable cause) {
        super(message, cause);
    }

}
