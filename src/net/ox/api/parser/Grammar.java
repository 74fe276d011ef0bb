package net.ox.api.parser;

import java.util.List;
import java.util.regex.Pattern;
import net.ox.api.NamedValue;

/**
 * A (context-free) Grammar defines a formal language, i.e. a set of strings
 * that it "matches".
 * The grammar consists of productions, which, in turn, consist of symbols,
 * and of named token definitions that split the input into the terminals the
 * productions refer to. A grammar carries at least one start symbol; it
 * matches those strings that are matched by its start symbol, which, in
 * turn, refers (directly or transitively) to productions in the grammar,
 * whose matching behavior is defined by the symbols contained inside
 * *them*. See the Production and Symbol interfaces for details on their
 * matching behavior.
 * This provides a mutable interface, along with factory methods for creating
 * various parts of a Grammar.
 */
public interface Grammar extends GrammarView {

    /**
     * An (immutable) element of a Production.
     * A Symbol can be a TerminalSymbol, which matches the strings matched by
     * some regular expression, or a NonterminalSymbol, which matches the
     * languages matched by productions or tokens with a corresponding name;
     * see the aforementioned interfaces for more details.
     * Classes implementing Symbol should implement the equals() (and
     * hashCode()) methods such that symbols created by passing equal
     * arguments to createNonterminal() and createTerminal() are equal, and
     * symbols created by passing unequal arguments to the factory methods
     * are not equal. Pattern-s are considered equal if their pattern strings
     * and flags are equal.
     */
    interface Symbol {

        /**
         * Splice the values produced by this symbol into the enclosing
         * production instead of nesting them.
         */
        int SYM_INLINE = 1;

        /**
         * Do not hand the value produced by this symbol to reducers (may be
         * overridden on a per-rule basis, see RULE_KEEP_ALL).
         */
        int SYM_DISCARD = 2;

        /**
         * Optionally skip this symbol (regular expression x?).
         * If the symbol is not matched, no value is produced for it.
         */
        int SYM_OPTIONAL = 4;

        /**
         * Permit repetitions of this symbol (regular expression x+).
         * Multiple matches produce adjacent values. Combine with
         * SYM_OPTIONAL to permit any amount of repetitions (regular
         * expression x*).
         */
        int SYM_REPEAT = 8;

        /**
         * All known Symbol flags combined.
         */
        int SYM_ALL = SYM_INLINE | SYM_DISCARD | SYM_OPTIONAL | SYM_REPEAT;

        /**
         * Retrieve the flags of this symbol.
         */
        int getFlags();

        /**
         * Return how strongly this Symbol should be preferred when producing
         * tokens.
         * Symbols with greater match ranks are preferred when other criteria
         * (priority and match length) are equal; literal terminals outrank
         * regular expressions.
         */
        int getMatchRank();

        /**
         * Return a copy of this Symbol modified to have the given flags.
         */
        Symbol withFlags(int newFlags);

    }

    /**
     * A Symbol whose language is defined by a set of productions or by a
     * named token.
     * If the reference names a token definition of the grammar, the symbol
     * is a terminal of the parser; otherwise, it matches whatever any of the
     * productions with that name match.
     */
    interface NonterminalSymbol extends Symbol {

        /**
         * The name of the production(s) or token this symbol references.
         */
        String getReference();

    }

    /**
     * An anonymous Symbol that matches literal text (defined by a regular
     * expression).
     * E.g., if a TerminalSymbol has a pattern of /Hello [Ww]orld/, then it
     * matches either the string "Hello World" or "Hello world".
     */
    interface TerminalSymbol extends Symbol {

        /**
         * A regular expression defining what strings this symbol matches.
         */
        Pattern getPattern();

        /**
         * Whether this symbol matches a single fixed string.
         */
        boolean isLiteral();

    }

    /**
     * An (immutable) element of a Grammar.
     * A Production has a name that relates it to same-named Production-s,
     * a list of Symbol-s that define what the Production matches, and an
     * optional alias used to bind a Reducer to it.
     * It matches the concatenation of the languages of its symbols (in their
     * respective order); e.g., if the symbols A, B, and C match the strings
     * "Hello", " ", and "World", then a production containing (only) A, B,
     * and C matches the string "Hello World".
     * Classes implementing Production should implement equals() (and
     * hashCode()) such that two productions are equal if-and-only-if their
     * names, their symbol lists, and their aliases are equal.
     */
    interface Production extends NamedValue {

        /**
         * The symbols of this Production.
         */
        List<Symbol> getSymbols();

        /**
         * The alias of this production, or null.
         */
        String getAlias();

    }

    /**
     * Create a NonterminalSymbol referring to the given name.
     */
    NonterminalSymbol createNonterminal(String reference, int flags);

    /**
     * Create a TerminalSymbol matching (only) the given string.
     */
    TerminalSymbol createTerminal(String content, int flags);

    /**
     * Create a TerminalSymbol matching the language matched by the given
     * Pattern.
     */
    TerminalSymbol createTerminal(Pattern pattern, int flags);

    /**
     * Create a Production with the given name, symbols, and alias (which
     * may be null).
     */
    Production createProduction(String name, List<Symbol> symbols,
                                String alias);

    /**
     * Create a named token definition.
     * Tokens with higher priorities are preferred over others regardless of
     * the length of their matches; transform may be null.
     */
    TokenSource.TokenPattern createTokenPattern(String name,
        TerminalSymbol symbol, int priority, ValueTransform transform);

    /**
     * Add the given production to the Grammar.
     */
    void addProduction(Production prod);

    /**
     * Remove the given production from the Grammar.
     */
    void removeProduction(Production prod);

    /**
     * Add the given token definition, replacing a same-named one.
     */
    void addTokenPattern(TokenSource.TokenPattern pattern);

    /**
     * Mark the named token as ignored.
     */
    void addIgnoredToken(String name);

    /**
     * Set the RULE_* flags of the named rule.
     */
    void setRuleFlags(String name, int flags);

    /**
     * Append a rule to the list of permitted start symbols.
     */
    void addStartName(String name);

}
