package net.ox.api.parser;

/**
 * Exception thrown when a grammar or a set of token declarations cannot be
 * turned into a working lexer or parser.
 * This covers malformed token names and patterns, references to undefined
 * symbols, and conflicts found while building the parse tables; the message
 * names the offending rule or token.
 */
public class InvalidGrammarException extends ParserException {

    public InvalidGrammarException() {
        super();
    }
    public InvalidGrammarException(String message) {
        super(message);
    }
    public InvalidGrammarException(Throwable cause) {
        super(cause);
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
