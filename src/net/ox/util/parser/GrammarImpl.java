package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.GrammarView;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MatchingException;
import net.ox.api.parser.TextLocation;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.ValueTransform;
import net.ox.ast.Token;
import net.ox.util.Formats;
import net.ox.util.NamedMap;
import net.ox.util.NamedSet;

public class GrammarImpl implements Grammar {

    public static abstract class AbstractSymbol implements Symbol {

        private final int flags;

        public AbstractSymbol(int flags) {
            this.flags = flags;
        }

        public String toString() {
            return Grammars.formatWithSymbolFlags(toStringBase(), getFlags());
        }

        public boolean equals(Object other) {
            if (! (other instanceof AbstractSymbol)) return false;
            AbstractSymbol co = (AbstractSymbol) other;
            return (getFlags() == co.getFlags() && matches(co) &&
                    co.matches(this));
        }

        public int hashCode() {
            return hashCodeBase() ^ getFlags();
        }

        protected abstract String toStringBase();

        protected abstract boolean matches(AbstractSymbol other);

        protected abstract int hashCodeBase();

        public int getFlags() {
            return flags;
        }

        public int getMatchRank() {
            return 0;
        }

    }

    public static class Nonterminal extends AbstractSymbol
            implements NonterminalSymbol {

        private final String reference;

        public Nonterminal(String reference, int flags) {
            super(flags);
            if (reference == null)
                throw new NullPointerException(
                    "Nonterminal reference may not be null");
            this.reference = reference;
        }

        protected String toStringBase() {
            return getReference();
        }

        protected boolean matches(AbstractSymbol other) {
            return ((other instanceof Nonterminal) &&
                getReference().equals(((Nonterminal) other).getReference()));
        }

        protected int hashCodeBase() {
            return reference.hashCode();
        }

        public String getReference() {
            return reference;
        }

        public Nonterminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new Nonterminal(getReference(), newFlags);
        }

    }

    public static class Terminal extends AbstractSymbol
            implements TerminalSymbol {

        private final Pattern pattern;

        public Terminal(Pattern pattern, int flags) {
            super(flags);
            if (pattern == null)
                throw new NullPointerException(
                    "Terminal pattern may not be null");
            this.pattern = pattern;
        }

        protected String toStringBase() {
            return Formats.formatPattern(getPattern());
        }

        protected boolean matches(AbstractSymbol other) {
            return ((other instanceof Terminal) &&
                    ((Terminal) other).isLiteral() == isLiteral() &&
                    patternsEqual(getPattern(),
                                  ((Terminal) other).getPattern()));
        }

        protected int hashCodeBase() {
            return patternHashCode(pattern);
        }

        public Pattern getPattern() {
            return pattern;
        }

        public boolean isLiteral() {
            return false;
        }

        public Terminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new Terminal(getPattern(), newFlags);
        }

        public static boolean patternsEqual(Pattern a, Pattern b) {
            if (a == null) return (b == null);
            if (b == null) return false;
            return (a.pattern().equals(b.pattern()) &&
                    a.flags() == b.flags());
        }

        public static int patternHashCode(Pattern pat) {
            if (pat == null) return 0;
            return pat.pattern().hashCode() ^ pat.flags();
        }

    }

    public static class FixedTerminal extends Terminal {

        private final String content;

        public FixedTerminal(String content, int flags) {
            super(Pattern.compile(Pattern.quote(content)), flags);
            this.content = content;
        }

        protected String toStringBase() {
            return Formats.formatString(getContent());
        }

        protected boolean matches(AbstractSymbol other) {
            return (other instanceof FixedTerminal) &&
                    getContent().equals(((FixedTerminal) other).getContent());
        }

        protected int hashCodeBase() {
            return content.hashCode();
        }

        public String getContent() {
            return content;
        }

        public boolean isLiteral() {
            return true;
        }

        public int getMatchRank() {
            return 100;
        }

        public FixedTerminal withFlags(int newFlags) {
            if (newFlags == getFlags()) return this;
            return new FixedTerminal(getContent(), newFlags);
        }

    }

    public static class ProductionImpl implements Production {

        private final String name;
        private final List<Symbol> symbols;
        private final String alias;

        public ProductionImpl(String name, List<Symbol> symbols,
                              String alias) {
            if (name == null)
                throw new NullPointerException(
                    "Production name may not be null");
            if (symbols == null)
                throw new NullPointerException(
                    "Production symbols may not be null");
            this.name = name;
            this.symbols = Collections.unmodifiableList(
                new ArrayList<Symbol>(symbols));
            this.alias = alias;
        }
        public ProductionImpl(String name, Symbol... symbols) {
            this(name, Arrays.asList(symbols), null);
        }

        public String toString() {
            return String.format("%s@%h[name=%s,symbols=%s,alias=%s]",
                getClass().getName(), this, getName(), getSymbols(),
                getAlias());
        }

        public boolean equals(Object other) {
            if (! (other instanceof Production)) return false;
            Production po = (Production) other;
            return (getName().equals(po.getName()) &&
                    getSymbols().equals(po.getSymbols()) &&
                    ((alias == null) ? po.getAlias() == null :
                                       alias.equals(po.getAlias())));
        }

        public int hashCode() {
            return getName().hashCode() ^ getSymbols().hashCode() ^
                ((alias == null) ? 0 : alias.hashCode());
        }

        public String getName() {
            return name;
        }

        public List<Symbol> getSymbols() {
            return symbols;
        }

        public String getAlias() {
            return alias;
        }

    }

    public static class TokenPatternImpl implements TokenSource.TokenPattern {

        private final String name;
        private final TerminalSymbol symbol;
        private final int priority;
        private final ValueTransform transform;

        public TokenPatternImpl(String name, TerminalSymbol symbol,
                                int priority, ValueTransform transform) {
            if (name == null)
                throw new NullPointerException(
                    "TokenPattern name may not be null");
            if (symbol == null)
                throw new NullPointerException(
                    "TokenPattern symbol may not be null");
            this.name = name;
            this.symbol = symbol;
            this.priority = priority;
            this.transform = transform;
        }

        public String toString() {
            return String.format("%s@%h[name=%s,symbol=%s,priority=%s]",
                getClass().getName(), this, getName(), getSymbol(),
                getPriority());
        }

        public boolean equals(Object other) {
            if (! (other instanceof TokenPatternImpl)) return false;
            TokenPatternImpl to = (TokenPatternImpl) other;
            return (getName().equals(to.getName()) &&
                    getSymbol().equals(to.getSymbol()) &&
                    getPriority() == to.getPriority() &&
                    getTransform() == to.getTransform());
        }

        public int hashCode() {
            return getName().hashCode() ^ getSymbol().hashCode() ^
                getPriority();
        }

        public String getName() {
            return name;
        }

        public TerminalSymbol getSymbol() {
            return symbol;
        }

        public int getPriority() {
            return priority;
        }

        public ValueTransform getTransform() {
            return transform;
        }

        public TokenPatternImpl withTransform(ValueTransform newTransform) {
            return new TokenPatternImpl(name, symbol, priority, newTransform);
        }

        public Token createToken(TextLocation start, TextLocation end,
                                 String content) throws MatchingException {
            Object value = content;
            if (transform != null) {
                try {
                    value = transform.transform(content);
                } catch (RuntimeException exc) {
                    throw new MatchingException(start, "Cannot convert " +
                        name + " token " + Formats.formatString(content) +
                        " at " + start + ": " + exc.getMessage(), exc);
                }
            }
            return new Token(value, name, start, end, content);
        }

    }

    public static final Pattern RULE_NAME_PATTERN = Pattern.compile(
        "[_a-z$][_a-z0-9$]*");
    public static final Pattern TOKEN_NAME_PATTERN = Pattern.compile(
        "_*[A-Z][_A-Z0-9]*");

    private final NamedMap<NamedSet<Production>> productions;
    private final Map<String, TokenSource.TokenPattern> tokens;
    private final Set<String> ignored;
    private final Map<String, Integer> ruleFlags;
    private final List<String> startNames;

    public GrammarImpl() {
        productions = new NamedMap<NamedSet<Production>>(
            new LinkedHashMap<String, NamedSet<Production>>());
        tokens = new LinkedHashMap<String, TokenSource.TokenPattern>();
        ignored = new LinkedHashSet<String>();
        ruleFlags = new HashMap<String, Integer>();
        startNames = new ArrayList<String>();
    }
    public GrammarImpl(GrammarView other) {
        this();
        for (String name : other.getProductionNames()) {
            for (Production prod : other.getProductions(name)) {
                addProduction(prod);
            }
            if (other.getRuleFlags(name) != 0)
                setRuleFlags(name, other.getRuleFlags(name));
        }
        tokens.putAll(other.getTokenPatterns());
        ignored.addAll(other.getIgnoredTokens());
        startNames.addAll(other.getStartNames());
    }

    public String toString() {
        return String.format("%s@%h[start=%s,rules=%s,tokens=%s]",
            getClass().getName(), this, startNames, productions.keySet(),
            tokens.keySet());
    }

    public Nonterminal createNonterminal(String reference, int flags) {
        return new Nonterminal(reference, flags);
    }
    public Terminal createTerminal(Pattern pattern, int flags) {
        return new Terminal(pattern, flags);
    }
    public FixedTerminal createTerminal(String content, int flags) {
        return new FixedTerminal(content, flags);
    }

    public ProductionImpl createProduction(String name,
                                           List<Symbol> symbols,
                                           String alias) {
        return new ProductionImpl(name, symbols, alias);
    }
    public ProductionImpl createProduction(String name, Symbol... symbols) {
        return new ProductionImpl(name, symbols);
    }

    public TokenPatternImpl createTokenPattern(String name,
            TerminalSymbol symbol, int priority, ValueTransform transform) {
        return new TokenPatternImpl(name, symbol, priority, transform);
    }

    // Immutable GrammarView interface.
    public Nonterminal getStartSymbol() {
        if (startNames.isEmpty()) return null;
        return new Nonterminal(startNames.get(0), 0);
    }

    public List<String> getStartNames() {
        return Collections.unmodifiableList(startNames);
    }

    public Set<String> getProductionNames() {
        return Collections.unmodifiableSet(productions.keySet());
    }
    public Set<Production> getProductions(String name) {
        Set<Production> ret = productions.get(name);
        if (ret == null) return Collections.emptySet();
        return Collections.unmodifiableSet(ret);
    }

    public int getRuleFlags(String name) {
        Integer ret = ruleFlags.get(name);
        return (ret == null) ? 0 : ret;
    }

    public Map<String, TokenSource.TokenPattern> getTokenPatterns() {
        return Collections.unmodifiableMap(tokens);
    }

    public Set<String> getIgnoredTokens() {
        return Collections.unmodifiableSet(ignored);
    }

    // Mutable direct interface.
    public boolean hasProductions(String name) {
        Set<Production> res = productions.get(name);
        return (res != null && ! res.isEmpty());
    }
    protected NamedSet<Production> getRawProductions(String name,
                                                     boolean create) {
        NamedSet<Production> ret = productions.get(name);
        if (ret == null && create) {
            ret = new NamedSet<Production>(name,
                                           new LinkedHashSet<Production>());
            productions.put(name, ret);
        }
        return ret;
    }

    public void addProduction(Production prod) {
        getRawProductions(prod.getName(), true).add(prod);
    }
    public void removeProduction(Production prod) {
        Set<Production> subset = getRawProductions(prod.getName(), false);
        if (subset == null) return;
        subset.remove(prod);
        if (subset.isEmpty()) productions.remove(prod.getName());
    }

    public void addTokenPattern(TokenSource.TokenPattern pattern) {
        tokens.put(pattern.getName(), pattern);
    }

    public void addIgnoredToken(String name) {
        ignored.add(name);
    }

    public void setRuleFlags(String name, int flags) {
        if (flags == 0) {
            ruleFlags.remove(name);
        } else {
            ruleFlags.put(name, flags);
        }
    }

    public void addStartName(String name) {
        if (! startNames.contains(name)) startNames.add(name);
    }

    /**
     * Check that the grammar is complete: there is a start symbol, every
     * start symbol and every reference is defined, rule and token names
     * are well-formed and disjoint, and all ignored tokens exist.
     */
    public void validate() throws InvalidGrammarException {
        if (startNames.isEmpty())
            throw new InvalidGrammarException("Missing start symbol");
        for (String name : startNames) {
            if (! hasProductions(name))
                throw new InvalidGrammarException("Start symbol " + name +
                    " has no productions");
        }
        for (String name : tokens.keySet()) {
            if (! TOKEN_NAME_PATTERN.matcher(name).matches())
                throw new InvalidGrammarException("Invalid token name " +
                    name);
            if (productions.containsKey(name))
                throw new InvalidGrammarException("Name " + name +
                    " denotes both a rule and a token");
        }
        for (String name : ignored) {
            if (! tokens.containsKey(name))
                throw new InvalidGrammarException("Ignored token " + name +
                    " is not defined");
        }
        for (NamedSet<Production> ps : productions.values()) {
            if (! RULE_NAME_PATTERN.matcher(ps.getName()).matches())
                throw new InvalidGrammarException("Invalid rule name " +
                    ps.getName());
            for (Production p : ps) {
                for (Symbol s : p.getSymbols()) {
                    if (! (s instanceof NonterminalSymbol)) continue;
                    String ref = ((NonterminalSymbol) s).getReference();
                    if (! hasProductions(ref) && ! tokens.containsKey(ref))
                        throw new InvalidGrammarException("Rule " +
                            ps.getName() + " references undefined symbol " +
                            ref);
                    if (ignored.contains(ref))
                        throw new InvalidGrammarException("Rule " +
                            ps.getName() + " references ignored token " +
                            ref);
                }
            }
        }
    }

}
