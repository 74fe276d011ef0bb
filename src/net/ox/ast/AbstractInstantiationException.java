package net.ox.ast;

/**
 * Thrown when an abstract AST type is instantiated.
 */
public class AbstractInstantiationException extends AstException {

    public AbstractInstantiationException() {
        super();
    }
    public AbstractInstantiationException(String message) {
        super(message);
    }
    public AbstractInstantiationException(Throwable cause) {
        super(cause);
    }
    public AbstractInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }

}
