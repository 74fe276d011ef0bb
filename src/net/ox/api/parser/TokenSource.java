package net.ox.api.parser;

import java.util.Map;
import net.ox.api.NamedValue;

/**
 * A dynamically reprogrammable externally driven tokenizer.
 * (Assuming a default implementation,) a TokenSource maintains an input
 * text, a current location inside it, a set of token definitions (the
 * *selection*), and a (cached) match result (which may be absent).
 * Upon a peek(), if there is no stored match result, the TokenSource
 * matches all token definitions from the current selection against the
 * input at the current location, stores the result of that match
 * operation, and returns its status code. If the match was successful,
 * the token produced by the match can be retrieved via getCurrentToken(). A
 * subsequent next() call advances the input location such that it points at
 * the end of the most recently matched token and clears the internal match
 * state, preparing for the next peek() call.
 * When several definitions match, the one with the highest priority wins;
 * among equal priorities the longest match wins, then the one whose symbol
 * has the greater match rank, then the one declared first.
 */
public interface TokenSource {

    /**
     * A token is a piece of text associated with a location inside the
     * input, a name (its type), and a semantic value.
     */
    interface Token extends NamedValue {

        /**
         * The location of the first character of this token.
         */
        TextLocation getLocation();

        /**
         * The location just past the last character of this token.
         */
        TextLocation getEndLocation();

        /**
         * The text this token encompasses.
         */
        String getContent();

        /**
         * The semantic value of this token.
         * This is the content unless the token's definition transforms it.
         */
        Object getValue();

    }

    /**
     * Interface representing the definition of a class of tokens.
     * This combines a name (from NamedValue) with a priority, a regular
     * expression defining possible token contents (from TerminalSymbol), and
     * an optional value transformation; the flags of the symbol are unused.
     */
    interface TokenPattern extends NamedValue {

        /**
         * The Symbol defining the token contents.
         */
        Grammar.TerminalSymbol getSymbol();

        /**
         * The priority of this definition (default zero).
         */
        int getPriority();

        /**
         * The transformation applied to the token text, or null.
         */
        ValueTransform getTransform();

        /**
         * Create a Token deriving from this TokenPattern.
         * The token's parameters are taken from this TokenPattern (for the
         * name and the value transform) and from this method's parameters
         * (for the locations and the content).
         */
        Token createToken(TextLocation start, TextLocation end,
                          String content) throws MatchingException;

    }

    /**
     * A set of token definitions.
     * The token definitions must have distinct names; this constraint and
     * the isCompatibleWith() and contains() methods attempt to optimize for
     * the common case of narrowing down a selection to a subset thereof while
     * retaining the current stored match result.
     */
    interface Selection {

        /**
         * The token definitions of this selection.
         * Each TokenPattern must be mapped to from its name.
         */
        Map<String, TokenPattern> getPatterns();

        /**
         * Quickly test whether this token definition set is a subset of
         * other.
         */
        boolean isCompatibleWith(Selection other);

        /**
         * Quickly test whether the given token stems from a definition
         * inside this Selection.
         */
        boolean contains(Token tok);

    }

    /**
     * The result of a token matching operation.
     */
    enum MatchStatus {
        /** Matching successfully resulted in a new token. */
        OK,
        /** No new token could be extracted. */
        NO_MATCH,
        /** The end of the input has been reached. */
        EOI
    }

    /**
     * Set the set of token definitions that should be matched against the
     * input.
     * If there is a cached match result that the new selection cannot
     * reproduce, it is discarded.
     */
    void setSelection(Selection sel);

    /**
     * Retrieve the current location of the TokenSource in its input.
     * The next token produced by this will have that location.
     */
    TextLocation getCurrentLocation();

    /**
     * Retrieve the latest token produced by this TokenSource, or null.
     */
    Token getCurrentToken();

    /**
     * Perform a match operation, set internal state fields, and return the
     * match's result.
     * If required is true and a NO_MATCH would have been returned otherwise,
     * this raises a MatchingException.
     */
    MatchStatus peek(boolean required) throws MatchingException;

    /**
     * Advance the internal position past the latest token, generating the
     * latter if necessary.
     * The token of the latest match operation is returned; if no token can
     * be produced (or the end of input has been reached), a
     * MatchingException is raised.
     */
    Token next() throws MatchingException;

}
