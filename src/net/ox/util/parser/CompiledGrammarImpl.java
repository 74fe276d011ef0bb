package net.ox.util.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.parser.CompiledGrammar;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.TokenSource;
import net.ox.util.config.Configuration;

public class CompiledGrammarImpl implements CompiledGrammar {

    private final GrammarImpl grammar;
    private final ParseTable table;
    private final String source;
    private final Configuration config;
    private final Set<String> aliases;
    private final TokenSource.Selection fullSelection;

    public CompiledGrammarImpl(GrammarImpl grammar, ParseTable table,
                               String source, Configuration config) {
        this.grammar = grammar;
        this.table = table;
        this.source = source;
        this.config = config;
        Set<String> aliases = new LinkedHashSet<String>();
        for (ParseTable.Rule r : table.getRules()) {
            if (r.getAlias() != null) aliases.add(r.getAlias());
        }
        this.aliases = Collections.unmodifiableSet(aliases);
        this.fullSelection = new Lexer.StandardSelection(
            grammar.getTokenPatterns());
    }

    public String toString() {
        return String.format("%s@%h[start=%s,states=%s]",
            getClass().getName(), this, getStartNames(),
            table.getStates().size());
    }

    public ParseTable getParseTable() {
        return table;
    }

    /**
     * A selection containing every token of this grammar.
     */
    public TokenSource.Selection getFullSelection() {
        return fullSelection;
    }

    public Grammar.NonterminalSymbol getStartSymbol() {
        return grammar.getStartSymbol();
    }

    public List<String> getStartNames() {
        return grammar.getStartNames();
    }

    public Set<String> getProductionNames() {
        return grammar.getProductionNames();
    }

    public Set<Grammar.Production> getProductions(String name) {
        return grammar.getProductions(name);
    }

    public int getRuleFlags(String name) {
        return grammar.getRuleFlags(name);
    }

    public Map<String, TokenSource.TokenPattern> getTokenPatterns() {
        return grammar.getTokenPatterns();
    }

    public Set<String> getIgnoredTokens() {
        return grammar.getIgnoredTokens();
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public String getSource() {
        return source;
    }

    public Lexer createTokenSource(String input) {
        Lexer ret = new Lexer(input, config);
        ret.setSelection(fullSelection);
        return ret;
    }

    /**
     * Create a parser invoking the given reducers.
     * Besides aliases, the map may name rules; such a reducer applies to
     * the productions of the rule that have no alias.
     */
    public Parser createParser(Map<String, Reducer> reducers)
            throws InvalidGrammarException {
        for (String key : reducers.keySet()) {
            if (! aliases.contains(key) && ! grammar.hasProductions(key))
                throw new InvalidGrammarException("Cannot bind reducer to " +
                    "unknown alias " + key);
        }
        return new ParserImpl(this, reducers);
    }
    public Parser createParser() {
        return new ParserImpl(this, Collections.<String, Reducer>emptyMap());
    }

}
