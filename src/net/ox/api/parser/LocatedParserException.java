package net.ox.api.parser;

/**
 * A generic ParserException that has an associated TextLocation.
 * The location may be null if the failure cannot be attributed to a
 * particular place in the input.
 */
public class LocatedParserException extends ParserException {

    private final TextLocation location;

    public LocatedParserException(TextLocation pos) {
        super();
        location = pos;
    }
    public LocatedParserException(TextLocation pos, String message) {
        super(message);
        location = pos;
    }
    public LocatedParserException(TextLocation pos, Throwable cause) {
        super(cause);
        location = pos;
    }
    public LocatedParserException(TextLocation pos, String message,
                                  Throwable cause) {
        super(message, cause);
        location = pos;
    }

    public TextLocation getLocation() {
        return location;
    }

}
