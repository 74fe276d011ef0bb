package net.ox.api.parser;

import java.util.List;
import net.ox.api.NamedValue;

/**
 * A grammar-driven LALR parser.
 * A parser receives tokens from a TokenSource (which it reprograms at each
 * step to consider only the token definitions acceptable in the current
 * state), matches them against its compiled grammar, and reduces the
 * matched symbols into values using Reducer-s (or into parse trees where
 * none are bound).
 * Parser-s hold no per-input state; parse() may be called concurrently from
 * multiple threads.
 * The CompiledGrammar interface contains factory methods for producing
 * Parser-s.
 */
public interface Parser {

    /**
     * A single parse tree node.
     * A parse tree has a name (that is either the name of the underlying
     * token or the name of the grammar rule or alias that gave rise to the
     * parse tree), an optional token (present on leaf nodes), and a list of
     * child nodes.
     */
    interface ParseTree extends NamedValue {

        /**
         * The token this ParseTree directly corresponds to, or null.
         */
        TokenSource.Token getToken();

        /**
         * An immutable list of this node's children.
         */
        List<? extends ParseTree> getChildren();

    }

    /**
     * The CompiledGrammar this parser has been derived from.
     */
    CompiledGrammar getGrammar();

    /**
     * Parse the given input starting from the grammar's default start
     * symbol.
     */
    Object parse(String input) throws ParsingException;

    /**
     * Parse the given input starting from the named start symbol.
     */
    Object parse(String input, String start) throws ParsingException;

    /**
     * Parse the tokens produced by the given TokenSource starting from the
     * named start symbol.
     * The parser installs its own selections into the source.
     */
    Object parse(TokenSource input, String start) throws ParsingException;

}
