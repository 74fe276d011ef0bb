package net.ox.api.parser;

import java.util.Map;
import java.util.Set;

/**
 * An immutable Grammar from which Parser-s can be derived.
 * Compiling a grammar resolves its anonymous terminals into named tokens and
 * builds the parse tables; a CompiledGrammar may be shared freely between
 * threads.
 */
public interface CompiledGrammar extends GrammarView {

    /**
     * The aliases of all productions, i.e. the names Reducer-s can be bound
     * to.
     */
    Set<String> getAliases();

    /**
     * The grammar text this grammar was read from, or null if it was
     * assembled programmatically.
     */
    String getSource();

    /**
     * Create a TokenSource splitting the given input using the token
     * definitions of this grammar.
     */
    TokenSource createTokenSource(String input);

    /**
     * Create a parser using this grammar that invokes the given reducers.
     * The map is keyed by production aliases; productions without a
     * reducer produce trees (or, where the rule permits it, pass their
     * single value through). Mentioning an unknown alias is an error.
     */
    Parser createParser(Map<String, Reducer> reducers)
        throws InvalidGrammarException;

    /**
     * Create a parser that uses no reducers at all.
     */
    Parser createParser();

}
