package net.ox.api.parser;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A read-only view of a Grammar.
 * The collections returned by the methods in this interface are
 * unmodifiable.
 */
public interface GrammarView {

    /**
     * Rule flag: if a production of the rule yields exactly one value, that
     * value is the result of the rule (instead of a tree wrapping it).
     * Written as a "?" before the rule name in grammar text.
     */
    int RULE_INLINE_SINGLE = 1;

    /**
     * Rule flag: anonymous literal tokens are not filtered from the values
     * handed to the rule's reducers.
     * Written as a "!" before the rule name in grammar text.
     */
    int RULE_KEEP_ALL = 2;

    /**
     * Rule flag: the values produced by the rule are spliced into the
     * enclosing production instead of being nested.
     * Applies to rule names starting with an underscore and to helper rules
     * synthesized for groups and repetitions.
     */
    int RULE_SPLICE = 4;

    /**
     * The default start symbol of the GrammarView.
     */
    Grammar.NonterminalSymbol getStartSymbol();

    /**
     * All rules that may be used as start symbols, the default one first.
     */
    List<String> getStartNames();

    /**
     * The names of all rules in this GrammarView.
     */
    Set<String> getProductionNames();

    /**
     * The productions of this GrammarView with the given name, or an empty
     * set if none.
     */
    Set<Grammar.Production> getProductions(String name);

    /**
     * The RULE_* flags of the rule with the given name (zero if none).
     */
    int getRuleFlags(String name);

    /**
     * The named token definitions of this GrammarView, in declaration order.
     */
    Map<String, TokenSource.TokenPattern> getTokenPatterns();

    /**
     * The names of the tokens that are matched but never handed to the
     * parser.
     */
    Set<String> getIgnoredTokens();

}
