package net.ox.ast;

/**
 * Thrown when a value cannot be converted into a member of a hierarchy; the message
 * names the value's class and the hierarchy's root.
 */
public class CoercionException extends AstException {

    public CoercionException() {
        super();
    }
    public CoercionException(String message) {
        super(message);
    }
    public CoercionException(Throwable cause) {
        super(cause);
    }
    public CoercionException(String message, Throwable cause) {
        super(message, cause);
    }

}
