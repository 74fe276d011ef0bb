package net.ox.api.parser;

/**
 * A conversion from the raw text of a token to its semantic value (e.g.
 * a number).
 */
public interface ValueTransform {

    /**
     * Convert the given token text.
     * Runtime exceptions thrown from here are reported as
     * MatchingException-s located at the token.
     */
    Object transform(String raw);

}
