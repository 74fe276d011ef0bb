package net.ox.util.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.parser.MatchingException;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.ValueTransform;
import net.ox.util.config.Configuration;

/**
 * The result of LexerCompiler: a set of token patterns along with the
 * grammar text they were read from.
 * Instances are immutable; lex() may be called concurrently.
 */
public class CompiledLexer {

    private final String source;
    private final Map<String, TokenSource.TokenPattern> patterns;
    private final Set<String> ignored;
    private final Configuration config;
    private final TokenSource.Selection selection;

    public CompiledLexer(String source,
                         Map<String, TokenSource.TokenPattern> patterns,
                         Set<String> ignored, Configuration config) {
        this.source = source;
        this.patterns = Collections.unmodifiableMap(
            new LinkedHashMap<String, TokenSource.TokenPattern>(patterns));
        this.ignored = Collections.unmodifiableSet(
            new LinkedHashSet<String>(ignored));
        this.config = config;
        this.selection = new Lexer.StandardSelection(this.patterns);
    }

    public String toString() {
        return String.format("%s@%h[tokens=%s,ignored=%s]",
            getClass().getName(), this, patterns.keySet(), ignored);
    }

    /**
     * The grammar text declaring the tokens of this lexer.
     */
    public String getGrammarSource() {
        return source;
    }

    public Map<String, TokenSource.TokenPattern> getTokenPatterns() {
        return patterns;
    }

    public Set<String> getIgnoredTokens() {
        return ignored;
    }

    /**
     * The value transform of the named token, or null.
     */
    public ValueTransform getTransform(String name) {
        TokenSource.TokenPattern tp = patterns.get(name);
        return (tp == null) ? null : tp.getTransform();
    }

    public Lexer createLexer(String input) {
        Lexer ret = new Lexer(input, config);
        ret.setSelection(selection);
        return ret;
    }

    /**
     * Split input into tokens, dropping ignored ones.
     */
    public List<TokenSource.Token> lex(String input)
            throws MatchingException {
        return createLexer(input).lex(ignored);
    }

}
