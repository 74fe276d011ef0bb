package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.GrammarView;
import net.ox.api.parser.Mapper;
import net.ox.api.parser.Mappers;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.RecordMapper;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.TransformMapper;
import net.ox.api.parser.UnionMapper;
import net.ox.util.Formats;

/* Converts the parse trees of the grammar meta-grammar into GrammarImpl
 * instances. The mappers produce a plain description of each definition,
 * which the reader then turns into productions or token patterns. */
class GrammarReader {

    public enum ElementKind { RULE, TOKEN, LITERAL, REGEX, GROUP, MAYBE }

    public static class Element {

        private final ElementKind kind;
        private final Object value;
        private final int quantifier;

        public Element(ElementKind kind, Object value, int quantifier) {
            this.kind = kind;
            this.value = value;
            this.quantifier = quantifier;
        }

        public String toString() {
            return String.format("%s@%h[kind=%s,value=%s,quantifier=%s]",
                getClass().getName(), this, kind, value, quantifier);
        }

        public ElementKind getKind() {
            return kind;
        }

        public Object getValue() {
            return value;
        }

        public int getQuantifier() {
            return quantifier;
        }

        public Element withQuantifier(int newQuantifier) {
            return new Element(kind, value, newQuantifier);
        }

        @SuppressWarnings("unchecked")
        public List<Alternative> getAlternatives() {
            return (List<Alternative>) value;
        }

    }

    public static class Alternative {

        private final List<Element> elements;
        private final String alias;

        public Alternative(List<Element> elements, String alias) {
            this.elements = Collections.unmodifiableList(
                new ArrayList<Element>(elements));
            this.alias = alias;
        }

        public String toString() {
            return String.format("%s@%h[elements=%s,alias=%s]",
                getClass().getName(), this, elements, alias);
        }

        public List<Element> getElements() {
            return elements;
        }

        public String getAlias() {
            return alias;
        }

    }

    public static class Definition {

        private final String kind;
        private final String name;
        private final String modifiers;
        private final int priority;
        private final List<Alternative> alternatives;

        public Definition(String kind, String name, String modifiers,
                          int priority, List<Alternative> alternatives) {
            this.kind = kind;
            this.name = name;
            this.modifiers = modifiers;
            this.priority = priority;
            this.alternatives = alternatives;
        }

        public String toString() {
            return String.format("%s@%h[kind=%s,name=%s]",
                getClass().getName(), this, kind, name);
        }

        public String getKind() {
            return kind;
        }

        public String getName() {
            return name;
        }

        public String getModifiers() {
            return modifiers;
        }

        public int getPriority() {
            return priority;
        }

        public List<Alternative> getAlternatives() {
            return alternatives;
        }

    }

    private static class MapperHolder {

        public static final UnionMapper<Element> CONTENT =
            new UnionMapper<Element>();

        public static final UnionMapper<Integer> QUANTIFIER =
            new UnionMapper<Integer>();

        public static final Mapper<Element> ELEMENT =
            new RecordMapper<Element>() {
                protected Element mapInner(Provider p)
                        throws MappingException {
                    Element ret = p.mapNext(CONTENT);
                    if (p.hasNext())
                        ret = ret.withQuantifier(p.mapNext(QUANTIFIER));
                    return ret;
                }
            };

        public static final Mapper<List<Element>> EXPANSION =
            Mappers.aggregate(ELEMENT);

        public static final Mapper<Alternative> ALTERNATIVE =
            new RecordMapper<Alternative>() {
                protected Alternative mapInner(Provider p)
                        throws MappingException {
                    List<Element> elements = p.mapNext(EXPANSION);
                    String alias = null;
                    if (p.hasNext()) alias = p.mapNext(Mappers.content());
                    return new Alternative(elements, alias);
                }
            };

        public static final Mapper<List<Alternative>> ALTERNATIVES =
            Mappers.aggregate(ALTERNATIVE);

        public static final Mapper<String> MODIFIERS =
            new RecordMapper<String>() {
                protected String mapInner(Provider p)
                        throws MappingException {
                    StringBuilder sb = new StringBuilder();
                    while (p.hasNext())
                        sb.append(p.mapNext(Mappers.content()));
                    return sb.toString();
                }
            };

        public static final UnionMapper<Definition> DEFINITION =
            new UnionMapper<Definition>();

        public static final Mapper<List<Definition>> GRAMMAR =
            Mappers.aggregate(DEFINITION);

        static {
            CONTENT.add("RULE", new TransformMapper<String, Element>(
                    Mappers.content()) {
                protected Element transform(String name) {
                    return new Element(ElementKind.RULE, name, 0);
                }
            });
            CONTENT.add("TOKEN", new TransformMapper<String, Element>(
                    Mappers.content()) {
                protected Element transform(String name) {
                    return new Element(ElementKind.TOKEN, name, 0);
                }
            });
            CONTENT.add("STRING", new TransformMapper<String, Element>(
                    Mappers.content()) {
                protected Element transform(String literal)
                        throws MappingException {
                    try {
                        return new Element(ElementKind.LITERAL,
                            Formats.parseStringLiteral(literal), 0);
                    } catch (IllegalArgumentException exc) {
                        throw new MappingException(exc.getMessage(), exc);
                    }
                }
            });
            CONTENT.add("REGEXP", new TransformMapper<String, Element>(
                    Mappers.content()) {
                protected Element transform(String literal)
                        throws MappingException {
                    return new Element(ElementKind.REGEX,
                                       parseRegex(literal), 0);
                }
            });
            CONTENT.add("group", TransformMapper.of(Mappers.unwrap(
                    ALTERNATIVES),
                new TransformMapper.Transformer<List<Alternative>,
                                                Element>() {
                    public Element transform(List<Alternative> alts) {
                        return new Element(ElementKind.GROUP, alts, 0);
                    }
                }));
            CONTENT.add("maybe", TransformMapper.of(Mappers.unwrap(
                    ALTERNATIVES),
                new TransformMapper.Transformer<List<Alternative>,
                                                Element>() {
                    public Element transform(List<Alternative> alts) {
                        return new Element(ElementKind.MAYBE, alts, 0);
                    }
                }));

            QUANTIFIER.add("QMARK",
                           Mappers.constant(Grammar.Symbol.SYM_OPTIONAL));
            QUANTIFIER.add("STAR",
                           Mappers.constant(Grammar.Symbol.SYM_OPTIONAL |
                                            Grammar.Symbol.SYM_REPEAT));
            QUANTIFIER.add("PLUS",
                           Mappers.constant(Grammar.Symbol.SYM_REPEAT));

            DEFINITION.add("rule_def", new RecordMapper<Definition>() {
                protected Definition mapInner(Provider p)
                        throws MappingException {
                    String modifiers = "";
                    Parser.ParseTree first = p.next();
                    if (first.getName().equals("modifiers")) {
                        modifiers = MODIFIERS.map(first);
                        first = p.next();
                    }
                    String name = Mappers.content().map(first);
                    return new Definition("rule", name, modifiers, 0,
                                          p.mapNext(ALTERNATIVES));
                }
            });
            DEFINITION.add("token_def", new RecordMapper<Definition>() {
                protected Definition mapInner(Provider p)
                        throws MappingException {
                    String name = p.mapNext(Mappers.content());
                    int priority = 0;
                    Parser.ParseTree next = p.next();
                    if (next.getName().equals("NUMBER")) {
                        priority = Integer.parseInt(
                            Mappers.content().map(next));
                        next = p.next();
                    }
                    return new Definition("token", name, "", priority,
                                          ALTERNATIVES.map(next));
                }
            });
            DEFINITION.add("ignore_def", new RecordMapper<Definition>() {
                protected Definition mapInner(Provider p)
                        throws MappingException {
                    return new Definition("ignore", null, "", 0,
                                          p.mapNext(ALTERNATIVES));
                }
            });
        }

    }

    private final List<String> starts;
    private final GrammarImpl grammar;
    private final Map<String, Integer> helperCounts;
    private int ignoreCount;

    public GrammarReader(List<String> starts) {
        this.starts = starts;
        this.grammar = new GrammarImpl();
        this.helperCounts = new HashMap<String, Integer>();
    }

    public String toString() {
        return String.format("%s@%h[grammar=%s]", getClass().getName(), this,
                             grammar);
    }

    static Pattern parseRegex(String literal) throws MappingException {
        int end = literal.lastIndexOf('/');
        try {
            return Pattern.compile(
                Formats.unescapeSlashes(literal.substring(1, end)),
                Formats.parsePatternFlags(literal.substring(end + 1)));
        } catch (PatternSyntaxException exc) {
            throw new MappingException("Invalid regular expression " +
                literal + ": " + exc.getDescription(), exc);
        } catch (IllegalArgumentException exc) {
            throw new MappingException(exc.getMessage(), exc);
        }
    }

    public GrammarImpl read(Parser.ParseTree tree) throws MappingException {
        List<Definition> defs = MapperHolder.GRAMMAR.map(tree);
        List<Definition> rules = new ArrayList<Definition>();
        for (Definition d : defs) {
            if (d.getKind().equals("token")) {
                readToken(d);
            } else if (d.getKind().equals("ignore")) {
                readIgnore(d);
            } else {
                if (grammar.hasProductions(d.getName()))
                    throw new MappingException("Rule " + d.getName() +
                                               " is defined twice");
                rules.add(d);
                // Reserve the name so duplicates are detected.
                grammar.addProduction(new GrammarImpl.ProductionImpl(
                    d.getName()));
            }
        }
        for (Definition d : rules) {
            grammar.removeProduction(new GrammarImpl.ProductionImpl(
                d.getName()));
            readRule(d);
        }
        for (String s : starts) grammar.addStartName(s);
        if (starts.isEmpty()) {
            if (grammar.hasProductions("start")) {
                grammar.addStartName("start");
            } else if (! rules.isEmpty()) {
                grammar.addStartName(rules.get(0).getName());
            }
        }
        return grammar;
    }

    private void readRule(Definition d) throws MappingException {
        String name = d.getName();
        int flags = 0;
        if (d.getModifiers().indexOf('?') != -1)
            flags |= GrammarView.RULE_INLINE_SINGLE;
        if (d.getModifiers().indexOf('!') != -1)
            flags |= GrammarView.RULE_KEEP_ALL;
        if (name.startsWith("_")) flags |= GrammarView.RULE_SPLICE;
        grammar.setRuleFlags(name, flags);
        boolean keepAll = ((flags & GrammarView.RULE_KEEP_ALL) != 0);
        for (Alternative alt : d.getAlternatives()) {
            grammar.addProduction(new GrammarImpl.ProductionImpl(name,
                toSymbols(name, alt.getElements(), keepAll),
                alt.getAlias()));
        }
        // An empty rule must still count as defined.
        if (d.getAlternatives().isEmpty())
            grammar.addProduction(new GrammarImpl.ProductionImpl(name));
    }

    private List<Grammar.Symbol> toSymbols(String rule,
            List<Element> elements, boolean keepAll)
            throws MappingException {
        List<Grammar.Symbol> ret = new ArrayList<Grammar.Symbol>();
        for (Element e : elements) {
            switch (e.getKind()) {
                case RULE:
                    String rname = (String) e.getValue();
                    ret.add(new GrammarImpl.Nonterminal(rname,
                        (rname.startsWith("_") ? Grammar.Symbol.SYM_INLINE :
                         0) | e.getQuantifier()));
                    break;
                case TOKEN:
                    String tname = (String) e.getValue();
                    ret.add(new GrammarImpl.Nonterminal(tname,
                        (tname.startsWith("_") ? Grammar.Symbol.SYM_DISCARD :
                         0) | e.getQuantifier()));
                    break;
                case LITERAL:
                    ret.add(new GrammarImpl.FixedTerminal(
                        (String) e.getValue(),
                        (keepAll ? 0 : Grammar.Symbol.SYM_DISCARD) |
                        e.getQuantifier()));
                    break;
                case REGEX:
                    ret.add(new GrammarImpl.Terminal((Pattern) e.getValue(),
                                                     e.getQuantifier()));
                    break;
                case GROUP:
                case MAYBE:
                    List<Alternative> alts = e.getAlternatives();
                    int quantifier = e.getQuantifier();
                    if (e.getKind() == ElementKind.MAYBE)
                        quantifier |= Grammar.Symbol.SYM_OPTIONAL;
                    if (alts.size() == 1 && alts.get(0).getAlias() == null &&
                            quantifier == 0) {
                        ret.addAll(toSymbols(rule, alts.get(0).getElements(),
                                             keepAll));
                        break;
                    }
                    ret.add(new GrammarImpl.Nonterminal(
                        helperRule(rule, alts, keepAll),
                        Grammar.Symbol.SYM_INLINE | quantifier));
                    break;
            }
        }
        return ret;
    }

    private String helperRule(String rule, List<Alternative> alts,
                              boolean keepAll) throws MappingException {
        String base = "__" + rule.replaceFirst("^_+", "") + "_";
        Integer count = helperCounts.get(base);
        int index = (count == null) ? 0 : count;
        String name;
        do {
            name = base + index++;
        } while (grammar.hasProductions(name));
        helperCounts.put(base, index);
        grammar.setRuleFlags(name, GrammarView.RULE_SPLICE |
            (keepAll ? GrammarView.RULE_KEEP_ALL : 0));
        for (Alternative alt : alts) {
            grammar.addProduction(new GrammarImpl.ProductionImpl(name,
                toSymbols(rule, alt.getElements(), keepAll),
                alt.getAlias()));
        }
        return name;
    }

    private void readToken(Definition d) throws MappingException {
        String name = d.getName();
        if (grammar.getTokenPatterns().containsKey(name))
            throw new MappingException("Token " + name +
                                       " is defined twice");
        grammar.addTokenPattern(new GrammarImpl.TokenPatternImpl(name,
            toTerminal(name, d.getAlternatives()), d.getPriority(), null));
    }

    private void readIgnore(Definition d) throws MappingException {
        List<Alternative> alts = d.getAlternatives();
        if (alts.size() == 1 && alts.get(0).getElements().size() == 1) {
            Element e = alts.get(0).getElements().get(0);
            if (e.getKind() == ElementKind.TOKEN && e.getQuantifier() == 0) {
                grammar.addIgnoredToken((String) e.getValue());
                return;
            }
        }
        String name;
        do {
            name = "__IGNORE_" + ignoreCount++;
        } while (grammar.getTokenPatterns().containsKey(name));
        grammar.addTokenPattern(new GrammarImpl.TokenPatternImpl(name,
            toTerminal(name, alts), 0, null));
        grammar.addIgnoredToken(name);
    }

    private Grammar.TerminalSymbol toTerminal(String token,
            List<Alternative> alts) throws MappingException {
        if (alts.size() == 1 && alts.get(0).getElements().size() == 1) {
            Element e = alts.get(0).getElements().get(0);
            if (e.getQuantifier() == 0 && e.getKind() == ElementKind.LITERAL)
                return new GrammarImpl.FixedTerminal((String) e.getValue(),
                                                     0);
            if (e.getQuantifier() == 0 && e.getKind() == ElementKind.REGEX)
                return new GrammarImpl.Terminal((Pattern) e.getValue(), 0);
        }
        String regex = toRegex(token, alts);
        try {
            return new GrammarImpl.Terminal(Pattern.compile(regex), 0);
        } catch (PatternSyntaxException exc) {
            throw new MappingException("Invalid pattern for token " + token +
                ": " + exc.getDescription(), exc);
        }
    }

    private String toRegex(String token, List<Alternative> alts)
            throws MappingException {
        StringBuilder sb = new StringBuilder();
        for (Alternative alt : alts) {
            if (alt.getAlias() != null)
                throw new MappingException("Token " + token +
                                           " may not have aliases");
            if (sb.length() != 0) sb.append('|');
            for (Element e : alt.getElements()) {
                sb.append(toRegex(token, e));
            }
        }
        return sb.toString();
    }

    private String toRegex(String token, Element e) throws MappingException {
        String base;
        switch (e.getKind()) {
            case LITERAL:
                base = Pattern.quote((String) e.getValue());
                break;
            case REGEX:
                base = embed((Pattern) e.getValue());
                break;
            case TOKEN:
                TokenSource.TokenPattern ref =
                    grammar.getTokenPatterns().get(e.getValue());
                if (ref == null)
                    throw new MappingException("Token " + token +
                        " references undefined token " + e.getValue());
                base = embed(ref.getSymbol().getPattern());
                break;
            case GROUP:
                base = "(?:" + toRegex(token, e.getAlternatives()) + ")";
                break;
            case MAYBE:
                base = "(?:" + toRegex(token, e.getAlternatives()) + ")?";
                break;
            default:
                throw new MappingException("Token " + token +
                    " references rule " + e.getValue());
        }
        switch (e.getQuantifier()) {
            case Grammar.Symbol.SYM_OPTIONAL:
                return "(?:" + base + ")?";
            case Grammar.Symbol.SYM_OPTIONAL | Grammar.Symbol.SYM_REPEAT:
                return "(?:" + base + ")*";
            case Grammar.Symbol.SYM_REPEAT:
                return "(?:" + base + ")+";
            default:
                return base;
        }
    }

    private static String embed(Pattern pat) {
        String flags = "";
        if ((pat.flags() & Pattern.CASE_INSENSITIVE) != 0) flags += "i";
        if ((pat.flags() & Pattern.MULTILINE) != 0) flags += "m";
        if ((pat.flags() & Pattern.DOTALL) != 0) flags += "s";
        if ((pat.flags() & Pattern.UNICODE_CASE) != 0) flags += "u";
        if ((pat.flags() & Pattern.COMMENTS) != 0) flags += "x";
        return "(?" + flags + ":" + pat.pattern() + ")";
    }

}
