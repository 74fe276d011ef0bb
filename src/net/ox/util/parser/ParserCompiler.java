package net.ox.util.parser;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.ox.api.NamedValue;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.TokenSource;
import net.ox.util.Formats;
import net.ox.util.Logging;
import net.ox.util.config.Configuration;
import net.ox.util.config.Settings;

/**
 * Builds a parser from a CompiledLexer and a RuleSet.
 * Every rule becomes a "?rule" definition (so that single values pass
 * through) whose alternatives carry an alias naming their reducer; the
 * lexer's grammar text is appended and the whole is compiled with
 * LALRCompiler.
 */
public class ParserCompiler {

    public static final String DEBUG_KEY = "ox.grammar.debug";

    public static final String DEFAULT_START = "start";

    private static final Logger LOGGER = Logging.getLogger("ParserCompiler");

    private final Configuration config;

    public ParserCompiler(Configuration config) {
        this.config = config;
    }
    public ParserCompiler() {
        this(Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[config=%s]", getClass().getName(), this,
                             config);
    }

    public Parser compile(CompiledLexer lexer, RuleSet rules)
            throws InvalidGrammarException {
        return compile(lexer, rules, null);
    }
    public Parser compile(CompiledLexer lexer, RuleSet rules, String start)
            throws InvalidGrammarException {
        if (rules.isEmpty())
            throw new InvalidGrammarException("No rules given");
        if (start == null)
            start = rules.getRuleNames().contains(DEFAULT_START) ?
                DEFAULT_START : rules.getRuleNames().iterator().next();
        Map<String, Reducer> reducers = new HashMap<String, Reducer>();
        String text = generateSource(rules, reducers) +
            lexer.getGrammarSource();
        if (Settings.getBoolean(config, DEBUG_KEY, false))
            LOGGER.info("Generated grammar:\n" + text);
        GrammarImpl grammar;
        try {
            grammar = Grammars.parseGrammar(text, start);
        } catch (InvalidGrammarException exc) {
            LOGGER.warning("Invalid generated grammar:\n" + text);
            throw exc;
        }
        for (TokenSource.TokenPattern tp : lexer.getTokenPatterns().values()) {
            TokenSource.TokenPattern own =
                grammar.getTokenPatterns().get(tp.getName());
            if (own != null && tp.getTransform() != null)
                grammar.addTokenPattern(((GrammarImpl.TokenPatternImpl) own)
                    .withTransform(tp.getTransform()));
        }
        CompiledGrammarImpl compiled = new LALRCompiler(config)
            .compile(grammar, text);
        return compiled.createParser(reducers);
    }

    /**
     * Render rules as grammar text, recording the reducer of every
     * generated alias in reducers.
     */
    public String generateSource(RuleSet rules,
            Map<String, Reducer> reducers) throws InvalidGrammarException {
        Set<String> taken = new HashSet<String>(rules.getRuleNames());
        StringBuilder sb = new StringBuilder();
        for (String name : rules.getRuleNames()) {
            String lead = "?" + name + " : ";
            String cont = Formats.repeat(" ", lead.length() - 2) + "| ";
            boolean first = true;
            for (RuleSet.Alternative alt : rules.getAlternatives(name)) {
                String alias = null;
                if (alt.getReducer() != null) {
                    alias = uniqueName(aliasBase(name, alt.getReducer()),
                                       taken);
                    reducers.put(alias, alt.getReducer());
                }
                List<String> pieces =
                    Grammars.splitAlternatives(alt.getPattern());
                for (String piece : pieces) {
                    sb.append(first ? lead : cont).append(piece);
                    if (alias != null) sb.append(" -> ").append(alias);
                    sb.append('\n');
                    first = false;
                }
            }
        }
        return sb.toString();
    }

    private static String aliasBase(String rule, Reducer reducer) {
        if (reducer instanceof NamedValue) {
            String name = ((NamedValue) reducer).getName();
            if (name != null) {
                String cand = name.toLowerCase().replaceAll("[^_a-z0-9]",
                                                            "_");
                if (! cand.isEmpty() &&
                        GrammarImpl.RULE_NAME_PATTERN.matcher(cand).matches())
                    return cand;
            }
        }
        return "fn_" + rule;
    }

    private static String uniqueName(String base, Set<String> taken) {
        String ret = base;
        for (int i = 1; taken.contains(ret); i++) ret = base + "_" + i;
        taken.add(ret);
        return ret;
    }

}
