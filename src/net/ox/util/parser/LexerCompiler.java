package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.ValueTransform;
import net.ox.util.Formats;
import net.ox.util.Logging;
import net.ox.util.config.Configuration;

/**
 * Builds a lexer from a table of token declarations.
 * Declarations are keyed by names of the form "[_]NAME[_N_]"; a leading
 * underscore marks the token as ignored and a "_N_" suffix assigns it the
 * priority N. The declaration itself may be:
 * <ul>
 * <li>a String holding a regular expression;</li>
 * <li>an Object[] pair of a regular expression and a ValueTransform;</li>
 * <li>a Map with a single regular expression key mapping to a
 *     ValueTransform (or null);</li>
 * <li>a LexRule.</li>
 * </ul>
 * The declarations are converted to grammar text and read back with
 * Grammars.parseGrammar(); the text is kept so that parser definitions
 * can embed it.
 */
public class LexerCompiler {

    public static final Pattern DECLARATION_NAME = Pattern.compile(
        "(_)?([A-Z][A-Z0-9_]*?)(?:_([0-9]+)_)?");

    private static final Logger LOGGER = Logging.getLogger("LexerCompiler");

    private final Configuration config;
    private final Map<String, LexRule> rules;
    private final Set<String> ignored;

    public LexerCompiler(Configuration config) {
        this.config = config;
        this.rules = new LinkedHashMap<String, LexRule>();
        this.ignored = new LinkedHashSet<String>();
    }
    public LexerCompiler() {
        this(Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[rules=%s,ignored=%s]",
            getClass().getName(), this, rules.keySet(), ignored);
    }

    public Map<String, LexRule> getRules() {
        return Collections.unmodifiableMap(rules);
    }

    public Set<String> getIgnored() {
        return Collections.unmodifiableSet(ignored);
    }

    /**
     * Add a declaration; see the class description for the forms of
     * declName and spec.
     */
    public LexerCompiler add(String declName, Object spec)
            throws InvalidGrammarException {
        Matcher m = DECLARATION_NAME.matcher(declName);
        if (! m.matches())
            throw new InvalidGrammarException("Invalid token name " +
                Formats.formatString(declName));
        LexRule rule = toRule(declName, spec);
        String name = m.group(2);
        rule = rule.withName(name);
        if (m.group(3) != null)
            rule = rule.withPriority(Integer.valueOf(m.group(3)));
        if (m.group(1) != null) rule = rule.withIgnore(true);
        return add(rule);
    }
    public LexerCompiler add(LexRule rule) throws InvalidGrammarException {
        rule.compilePattern();
        if (rules.containsKey(rule.getName()))
            throw new InvalidGrammarException("Token " + rule.getName() +
                                              " is declared twice");
        rules.put(rule.getName(), rule);
        if (rule.isIgnored()) ignored.add(rule.getName());
        return this;
    }

    public LexerCompiler token(String name, String regex)
            throws InvalidGrammarException {
        return add(new LexRule(name, regex, null, null, false));
    }
    public LexerCompiler token(String name, String regex,
            ValueTransform transform) throws InvalidGrammarException {
        return add(new LexRule(name, regex, transform, null, false));
    }

    /**
     * Mark tokens as ignored.
     * Each name may itself be a comma-separated list of names.
     */
    public LexerCompiler ignore(String... names) {
        for (String n : names) {
            for (String part : n.split(",")) {
                part = part.trim();
                if (! part.isEmpty()) ignored.add(part);
            }
        }
        return this;
    }
    public LexerCompiler ignore(Collection<String> names) {
        return ignore(names.toArray(new String[names.size()]));
    }

    public LexerCompiler addAll(Map<String, ?> specs)
            throws InvalidGrammarException {
        for (Map.Entry<String, ?> ent : specs.entrySet()) {
            add(ent.getKey(), ent.getValue());
        }
        return this;
    }

    /**
     * Render the declarations as grammar text.
     * Tokens with explicit priorities come first, in descending order.
     */
    public String generateSource() throws InvalidGrammarException {
        for (String name : ignored) {
            if (! rules.containsKey(name))
                throw new InvalidGrammarException("Cannot ignore undeclared " +
                                                  "token " + name);
        }
        List<LexRule> sorted = new ArrayList<LexRule>(rules.values());
        Collections.sort(sorted, new Comparator<LexRule>() {
            public int compare(LexRule a, LexRule b) {
                return Integer.compare(b.getEffectivePriority(),
                                       a.getEffectivePriority());
            }
        });
        StringBuilder sb = new StringBuilder();
        for (LexRule r : sorted) {
            sb.append(r.getName());
            if (r.getPriority() != null)
                sb.append('.').append(r.getPriority());
            sb.append(" : ").append(formatRegex(r.compilePattern()))
              .append('\n');
        }
        for (String name : ignored) {
            sb.append("%ignore ").append(name).append('\n');
        }
        return sb.toString();
    }

    public CompiledLexer compile() throws InvalidGrammarException {
        String source = generateSource();
        GrammarImpl grammar;
        try {
            grammar = Grammars.parseGrammar(source);
        } catch (InvalidGrammarException exc) {
            LOGGER.warning("Invalid token declarations:\n" + source);
            throw new InvalidGrammarException("Invalid token declarations: " +
                                              exc.getMessage(), exc);
        }
        Map<String, TokenSource.TokenPattern> patterns =
            bindTransforms(grammar.getTokenPatterns(), rules);
        LOGGER.fine("Compiled lexer with " + patterns.size() + " tokens");
        return new CompiledLexer(source, patterns, ignored, config);
    }

    public static CompiledLexer compile(Map<String, ?> specs,
            Object ignore) throws InvalidGrammarException {
        LexerCompiler ret = new LexerCompiler().addAll(specs);
        if (ignore instanceof String) {
            ret.ignore((String) ignore);
        } else if (ignore instanceof Collection<?>) {
            for (Object o : (Collection<?>) ignore) ret.ignore((String) o);
        } else if (ignore != null) {
            throw new InvalidGrammarException("Invalid ignore list " +
                                              ignore);
        }
        return ret.compile();
    }

    /* Attach the transforms of rules to the correspondingly named
     * patterns. */
    static Map<String, TokenSource.TokenPattern> bindTransforms(
            Map<String, TokenSource.TokenPattern> patterns,
            Map<String, LexRule> rules) {
        Map<String, TokenSource.TokenPattern> ret =
            new LinkedHashMap<String, TokenSource.TokenPattern>();
        for (TokenSource.TokenPattern tp : patterns.values()) {
            LexRule rule = rules.get(tp.getName());
            if (rule != null && rule.getTransform() != null)
                tp = ((GrammarImpl.TokenPatternImpl) tp).withTransform(
                    rule.getTransform());
            ret.put(tp.getName(), tp);
        }
        return ret;
    }

    private static LexRule toRule(String declName, Object spec)
            throws InvalidGrammarException {
        if (spec instanceof LexRule) {
            return (LexRule) spec;
        } else if (spec instanceof String) {
            return new LexRule((String) spec);
        } else if (spec instanceof Object[]) {
            Object[] pair = (Object[]) spec;
            if (pair.length == 2 && pair[0] instanceof String &&
                    (pair[1] == null || pair[1] instanceof ValueTransform))
                return new LexRule((String) pair[0], (ValueTransform) pair[1]);
        } else if (spec instanceof Map<?, ?>) {
            Map<?, ?> map = (Map<?, ?>) spec;
            if (map.size() != 1)
                throw new InvalidGrammarException("Declaration of token " +
                    declName + " must map exactly one pattern, got " +
                    map.size());
            Map.Entry<?, ?> ent = map.entrySet().iterator().next();
            if (ent.getKey() instanceof String && (ent.getValue() == null ||
                    ent.getValue() instanceof ValueTransform))
                return new LexRule((String) ent.getKey(),
                                   (ValueTransform) ent.getValue());
        }
        throw new InvalidGrammarException("Invalid declaration of token " +
                                          declName + ": " + spec);
    }

    private static String formatRegex(Pattern pat) {
        String ret = Formats.formatPattern(pat);
        return ret.replace("\r", "\\r").replace("\n", "\\n");
    }

}
