package net.ox.api.parser;

/**
 * Exception thrown by TokenSource-s when the input cannot be split into
 * tokens, e.g. because no token definition matches at the current location.
 */
public class MatchingException extends LocatedParserException {

    public MatchingException(TextLocation pos) {
        super(pos);
    }
    public MatchingException(TextLocation pos, String message) {
        super(pos, message);
    }
    public MatchingException(TextLocation pos, Throwable cause) {
        super(pos, cause);
    }
    public MatchingException(TextLocation pos, String message,
                             Throwable cause) {
        super(pos, message, cause);
    }

}
