package net.ox.api.parser;

/**
 * Exception thrown on object mapping failures.
 * Raised by Mapper-s converting parse trees into other objects and by
 * Reducer-s rejecting the values they are handed.
 */
public class MappingException extends ParserException {

    public MappingException() {
        super();
    }
    public MappingException(String message) {
        super(message);
    }
    public MappingException(Throwable cause) {
        super(cause);
    }
    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }

}
