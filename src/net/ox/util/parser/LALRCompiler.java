package net.ox.util.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.GrammarView;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.TokenSource;
import net.ox.util.Logging;
import net.ox.util.config.Configuration;
import net.ox.util.config.Settings;

/**
 * Compiles grammars into LALR(1) parse tables.
 * Compilation proceeds in three steps: anonymous terminals are given token
 * names, optional and repeated symbols are expanded into plain productions,
 * and the LALR(1) automaton is built by propagating lookaheads over the
 * LR(0) item sets.
 */
public class LALRCompiler {

    public static final String SHIFT_REDUCE_KEY = "ox.parser.shiftReduce";

    public static final String START_PREFIX = "$start_";

    public static final String ANONYMOUS_PREFIX = "__ANON_";

    public static final String REPEAT_PREFIX = "__rep_";

    private static final Logger LOGGER = Logging.getLogger("LALRCompiler");

    private static final Pattern WORD = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*");

    private static final Map<Character, String> PUNCTUATION_NAMES;

    static {
        Map<Character, String> names = new HashMap<Character, String>();
        String[] table = {
            "(LPAR", ")RPAR", "[LSQB", "]RSQB", "{LBRACE", "}RBRACE",
            "+PLUS", "-MINUS", "*STAR", "/SLASH", "%PERCENT",
            "^CIRCUMFLEX", "&AMPERSAND", "|VBAR", "~TILDE", "!BANG",
            "?QMARK", "=EQUAL", "<LESSTHAN", ">MORETHAN", ",COMMA",
            ".DOT", ":COLON", ";SEMICOLON", "@AT", "#HASH", "$DOLLAR",
            "\"DBLQUOTE", "'QUOTE", "`BACKQUOTE", "\\BACKSLASH"
        };
        for (String ent : table) {
            names.put(ent.charAt(0), ent.substring(1));
        }
        PUNCTUATION_NAMES = Collections.unmodifiableMap(names);
    }

    /* Assigns token names to anonymous terminals. */
    private static class TerminalNamer {

        private final GrammarImpl target;
        private final Map<String, String> literals;
        private final Map<String, String> regexes;
        private int anonymous;

        public TerminalNamer(GrammarImpl target) {
            this.target = target;
            this.literals = new HashMap<String, String>();
            this.regexes = new HashMap<String, String>();
            for (TokenSource.TokenPattern tp :
                     target.getTokenPatterns().values()) {
                if (target.getIgnoredTokens().contains(tp.getName()))
                    continue;
                Grammar.TerminalSymbol sym = tp.getSymbol();
                if (sym instanceof GrammarImpl.FixedTerminal) {
                    String content =
                        ((GrammarImpl.FixedTerminal) sym).getContent();
                    if (! literals.containsKey(content))
                        literals.put(content, tp.getName());
                } else {
                    String key = regexKey(sym.getPattern());
                    if (! regexes.containsKey(key))
                        regexes.put(key, tp.getName());
                }
            }
        }

        public String nameFor(Grammar.TerminalSymbol sym) {
            if (sym instanceof GrammarImpl.FixedTerminal) {
                String content = ((GrammarImpl.FixedTerminal) sym).getContent();
                String ret = literals.get(content);
                if (ret != null) return ret;
                ret = literalName(content);
                if (ret == null || isTaken(ret)) ret = anonymousName();
                target.addTokenPattern(new GrammarImpl.TokenPatternImpl(ret,
                    new GrammarImpl.FixedTerminal(content, 0), 0, null));
                literals.put(content, ret);
                return ret;
            } else {
                String key = regexKey(sym.getPattern());
                String ret = regexes.get(key);
                if (ret != null) return ret;
                ret = anonymousName();
                target.addTokenPattern(new GrammarImpl.TokenPatternImpl(ret,
                    new GrammarImpl.Terminal(sym.getPattern(), 0), 0, null));
                regexes.put(key, ret);
                return ret;
            }
        }

        private boolean isTaken(String name) {
            return (target.getTokenPatterns().containsKey(name) ||
                    target.hasProductions(name));
        }

        private String anonymousName() {
            String ret;
            do {
                ret = ANONYMOUS_PREFIX + anonymous++;
            } while (isTaken(ret));
            return ret;
        }

        private static String regexKey(Pattern pat) {
            return pat.flags() + "/" + pat.pattern();
        }

        private static String literalName(String content) {
            if (content.isEmpty()) return null;
            if (WORD.matcher(content).matches()) {
                String ret = content.toUpperCase();
                return (GrammarImpl.TOKEN_NAME_PATTERN.matcher(ret).matches()) ?
                    ret : null;
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < content.length(); i++) {
                String part = PUNCTUATION_NAMES.get(content.charAt(i));
                if (part == null) return null;
                if (i != 0) sb.append('_');
                sb.append(part);
            }
            return sb.toString();
        }

    }

    /* The LR(0) automaton over integer-coded symbols, with LALR(1)
     * lookaheads for its kernel items. Terminals are numbered from zero
     * (the end marker), nonterminals follow them. Items are numbered
     * consecutively per production, one per dot position. */
    private static class Automaton {

        private final int numTerminals;
        private final int[] lhs;
        private final int[][] rhs;
        private final List<List<Integer>> productionsByLhs;
        private final int[] itemBase;
        private final int[] itemProduction;
        private final int[] itemDot;
        private final boolean[] nullable;
        private final BitSet[] first;
        private final List<int[]> kernels;
        private final Map<String, Integer> kernelIndex;
        private final List<Map<Integer, Integer>> transitions;
        private BitSet[][] lookaheads;

        public Automaton(int numTerminals, int numNonterminals, int[] lhs,
                         int[][] rhs) {
            this.numTerminals = numTerminals;
            this.lhs = lhs;
            this.rhs = rhs;
            this.productionsByLhs = new ArrayList<List<Integer>>();
            for (int i = 0; i < numNonterminals; i++) {
                productionsByLhs.add(new ArrayList<Integer>());
            }
            this.itemBase = new int[lhs.length];
            int items = 0;
            for (int p = 0; p < lhs.length; p++) {
                productionsByLhs.get(lhs[p] - numTerminals).add(p);
                itemBase[p] = items;
                items += rhs[p].length + 1;
            }
            this.itemProduction = new int[items];
            this.itemDot = new int[items];
            for (int p = 0; p < lhs.length; p++) {
                for (int d = 0; d <= rhs[p].length; d++) {
                    itemProduction[itemBase[p] + d] = p;
                    itemDot[itemBase[p] + d] = d;
                }
            }
            this.nullable = new boolean[numNonterminals];
            this.first = new BitSet[numNonterminals];
            for (int i = 0; i < numNonterminals; i++) first[i] = new BitSet();
            this.kernels = new ArrayList<int[]>();
            this.kernelIndex = new HashMap<String, Integer>();
            this.transitions = new ArrayList<Map<Integer, Integer>>();
        }

        /* The marker standing for "the lookahead of the originating item"
         * while lookaheads are being propagated. */
        private int propagationMarker() {
            return numTerminals;
        }

        private boolean isTerminal(int symbol) {
            return symbol < numTerminals;
        }

        private static boolean merge(BitSet target, BitSet source) {
            BitSet added = (BitSet) source.clone();
            added.andNot(target);
            if (added.isEmpty()) return false;
            target.or(added);
            return true;
        }

        public void computeFirstSets() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int p = 0; p < lhs.length; p++) {
                    int a = lhs[p] - numTerminals;
                    boolean allNullable = true;
                    for (int x : rhs[p]) {
                        if (isTerminal(x)) {
                            if (! first[a].get(x)) {
                                first[a].set(x);
                                changed = true;
                            }
                            allNullable = false;
                            break;
                        }
                        if (merge(first[a], first[x - numTerminals]))
                            changed = true;
                        if (! nullable[x - numTerminals]) {
                            allNullable = false;
                            break;
                        }
                    }
                    if (allNullable && ! nullable[a]) {
                        nullable[a] = true;
                        changed = true;
                    }
                }
            }
        }

        private BitSet firstOf(int[] seq, int from, BitSet tail) {
            BitSet ret = new BitSet();
            for (int i = from; i < seq.length; i++) {
                int x = seq[i];
                if (isTerminal(x)) {
                    ret.set(x);
                    return ret;
                }
                ret.or(first[x - numTerminals]);
                if (! nullable[x - numTerminals]) return ret;
            }
            ret.or(tail);
            return ret;
        }

        private int[] closure(int[] kernel) {
            BitSet items = new BitSet();
            Deque<Integer> pending = new ArrayDeque<Integer>();
            for (int k : kernel) {
                items.set(k);
                pending.add(k);
            }
            while (! pending.isEmpty()) {
                int i = pending.poll();
                int p = itemProduction[i], d = itemDot[i];
                if (d == rhs[p].length || isTerminal(rhs[p][d])) continue;
                for (int q : productionsByLhs.get(rhs[p][d] - numTerminals)) {
                    if (items.get(itemBase[q])) continue;
                    items.set(itemBase[q]);
                    pending.add(itemBase[q]);
                }
            }
            return items.stream().toArray();
        }

        /* LR(1) closure of the given items (mapping items to their
         * lookahead sets). */
        public Map<Integer, BitSet> closure(Map<Integer, BitSet> kernel) {
            Map<Integer, BitSet> ret = new TreeMap<Integer, BitSet>();
            Deque<Integer> pending = new ArrayDeque<Integer>();
            for (Map.Entry<Integer, BitSet> ent : kernel.entrySet()) {
                ret.put(ent.getKey(), (BitSet) ent.getValue().clone());
                pending.add(ent.getKey());
            }
            while (! pending.isEmpty()) {
                int i = pending.poll();
                int p = itemProduction[i], d = itemDot[i];
                if (d == rhs[p].length || isTerminal(rhs[p][d])) continue;
                BitSet la = firstOf(rhs[p], d + 1, ret.get(i));
                for (int q : productionsByLhs.get(rhs[p][d] - numTerminals)) {
                    int j = itemBase[q];
                    BitSet cur = ret.get(j);
                    if (cur == null) {
                        ret.put(j, (BitSet) la.clone());
                        pending.add(j);
                    } else if (merge(cur, la)) {
                        pending.add(j);
                    }
                }
            }
            return ret;
        }

        private int addState(int[] kernel) {
            String key = Arrays.toString(kernel);
            Integer ret = kernelIndex.get(key);
            if (ret != null) return ret;
            ret = kernels.size();
            kernels.add(kernel);
            kernelIndex.put(key, ret);
            transitions.add(new TreeMap<Integer, Integer>());
            return ret;
        }

        public int[] buildStates(int[] startProductions) {
            int[] ret = new int[startProductions.length];
            for (int i = 0; i < startProductions.length; i++) {
                ret[i] = addState(new int[] { itemBase[startProductions[i]] });
            }
            for (int s = 0; s < kernels.size(); s++) {
                Map<Integer, List<Integer>> bySymbol =
                    new TreeMap<Integer, List<Integer>>();
                for (int i : closure(kernels.get(s))) {
                    int p = itemProduction[i], d = itemDot[i];
                    if (d == rhs[p].length) continue;
                    List<Integer> next = bySymbol.get(rhs[p][d]);
                    if (next == null) {
                        next = new ArrayList<Integer>();
                        bySymbol.put(rhs[p][d], next);
                    }
                    next.add(i + 1);
                }
                for (Map.Entry<Integer, List<Integer>> ent :
                         bySymbol.entrySet()) {
                    int[] kernel = new int[ent.getValue().size()];
                    for (int k = 0; k < kernel.length; k++) {
                        kernel[k] = ent.getValue().get(k);
                    }
                    int target = addState(kernel);
                    transitions.get(s).put(ent.getKey(), target);
                }
            }
            return ret;
        }

        public void computeLookaheads(int[] startStates) {
            int n = kernels.size();
            lookaheads = new BitSet[n][];
            for (int s = 0; s < n; s++) {
                lookaheads[s] = new BitSet[kernels.get(s).length];
                for (int k = 0; k < lookaheads[s].length; k++) {
                    lookaheads[s][k] = new BitSet();
                }
            }
            List<int[]> propagation = new ArrayList<int[]>();
            BitSet marker = new BitSet();
            marker.set(propagationMarker());
            for (int s = 0; s < n; s++) {
                int[] kernel = kernels.get(s);
                for (int k = 0; k < kernel.length; k++) {
                    Map<Integer, BitSet> cl = closure(
                        Collections.singletonMap(kernel[k], marker));
                    for (Map.Entry<Integer, BitSet> ent : cl.entrySet()) {
                        int i = ent.getKey();
                        int p = itemProduction[i], d = itemDot[i];
                        if (d == rhs[p].length) continue;
                        int t = transitions.get(s).get(rhs[p][d]);
                        int tk = Arrays.binarySearch(kernels.get(t), i + 1);
                        BitSet la = ent.getValue();
                        for (int b = la.nextSetBit(0); b >= 0;
                             b = la.nextSetBit(b + 1)) {
                            if (b == propagationMarker()) {
                                propagation.add(new int[] { s, k, t, tk });
                            } else {
                                lookaheads[t][tk].set(b);
                            }
                        }
                    }
                }
            }
            for (int s : startStates) lookaheads[s][0].set(0);
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int[] e : propagation) {
                    if (merge(lookaheads[e[2]][e[3]], lookaheads[e[0]][e[1]]))
                        changed = true;
                }
            }
        }

        public int getStateCount() {
            return kernels.size();
        }

        public Map<Integer, Integer> getTransitions(int state) {
            return transitions.get(state);
        }

        /* The complete LR(1) item set of the given state. */
        public Map<Integer, BitSet> getItems(int state) {
            int[] kernel = kernels.get(state);
            Map<Integer, BitSet> seed = new TreeMap<Integer, BitSet>();
            for (int k = 0; k < kernel.length; k++) {
                seed.put(kernel[k], lookaheads[state][k]);
            }
            return closure(seed);
        }

        public int getItemProduction(int item) {
            return itemProduction[item];
        }

        public boolean isComplete(int item) {
            return itemDot[item] == rhs[itemProduction[item]].length;
        }

    }

    private final Configuration config;

    public LALRCompiler(Configuration config) {
        this.config = config;
    }
    public LALRCompiler() {
        this(Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[shiftReduce=%s]", getClass().getName(),
                             this, isStrict() ? "error" : "shift");
    }

    protected Configuration getConfiguration() {
        return config;
    }

    protected boolean isStrict() {
        return Settings.getString(config, SHIFT_REDUCE_KEY, "shift")
            .equalsIgnoreCase("error");
    }

    /**
     * Compile the given grammar.
     * text is the grammar source to report from the result (may be null).
     */
    public CompiledGrammarImpl compile(GrammarView source, String text)
            throws InvalidGrammarException {
        GrammarImpl resolved = resolveTerminals(source);
        resolved.validate();
        ParseTable table = buildTable(expandSymbols(resolved));
        return new CompiledGrammarImpl(resolved, table, text, config);
    }
    public CompiledGrammarImpl compile(GrammarView source)
            throws InvalidGrammarException {
        return compile(source, null);
    }

    private static GrammarImpl copyLexicalPart(GrammarView source) {
        GrammarImpl ret = new GrammarImpl();
        for (TokenSource.TokenPattern tp :
                 source.getTokenPatterns().values()) {
            ret.addTokenPattern(tp);
        }
        for (String name : source.getIgnoredTokens()) {
            ret.addIgnoredToken(name);
        }
        for (String name : source.getStartNames()) {
            ret.addStartName(name);
        }
        for (String name : source.getProductionNames()) {
            ret.setRuleFlags(name, source.getRuleFlags(name));
        }
        return ret;
    }

    /**
     * Replace all anonymous terminals in source by references to named
     * tokens, defining new tokens where necessary.
     */
    protected GrammarImpl resolveTerminals(GrammarView source) {
        GrammarImpl ret = copyLexicalPart(source);
        TerminalNamer namer = new TerminalNamer(ret);
        for (String name : source.getProductionNames()) {
            for (Grammar.Production p : source.getProductions(name)) {
                List<Grammar.Symbol> syms = new ArrayList<Grammar.Symbol>();
                for (Grammar.Symbol s : p.getSymbols()) {
                    if (s instanceof Grammar.TerminalSymbol) {
                        syms.add(new GrammarImpl.Nonterminal(
                            namer.nameFor((Grammar.TerminalSymbol) s),
                            s.getFlags()));
                    } else {
                        syms.add(s);
                    }
                }
                ret.addProduction(new GrammarImpl.ProductionImpl(name, syms,
                    p.getAlias()));
            }
        }
        return ret;
    }

    /**
     * Expand optional symbols into alternative productions and repeated
     * symbols into left-recursive helper rules.
     */
    protected GrammarImpl expandSymbols(GrammarImpl source) {
        GrammarImpl ret = copyLexicalPart(source);
        Map<Grammar.Symbol, String> helpers =
            new HashMap<Grammar.Symbol, String>();
        int strip = Grammar.Symbol.SYM_OPTIONAL | Grammar.Symbol.SYM_REPEAT;
        for (String name : source.getProductionNames()) {
            for (Grammar.Production p : source.getProductions(name)) {
                List<List<Grammar.Symbol>> variants =
                    new ArrayList<List<Grammar.Symbol>>();
                variants.add(new ArrayList<Grammar.Symbol>());
                for (Grammar.Symbol s : p.getSymbols()) {
                    Grammar.Symbol base = s.withFlags(s.getFlags() & ~strip);
                    if ((s.getFlags() & Grammar.Symbol.SYM_REPEAT) != 0)
                        base = new GrammarImpl.Nonterminal(
                            repeatHelper(ret, helpers, base),
                            Grammar.Symbol.SYM_INLINE);
                    if ((s.getFlags() & Grammar.Symbol.SYM_OPTIONAL) != 0) {
                        List<List<Grammar.Symbol>> next =
                            new ArrayList<List<Grammar.Symbol>>();
                        for (List<Grammar.Symbol> v : variants) {
                            List<Grammar.Symbol> with =
                                new ArrayList<Grammar.Symbol>(v);
                            with.add(base);
                            next.add(v);
                            next.add(with);
                        }
                        variants = next;
                    } else {
                        for (List<Grammar.Symbol> v : variants) v.add(base);
                    }
                }
                for (List<Grammar.Symbol> v : variants) {
                    ret.addProduction(new GrammarImpl.ProductionImpl(name, v,
                        p.getAlias()));
                }
            }
        }
        return ret;
    }

    private static String repeatHelper(GrammarImpl target,
                                       Map<Grammar.Symbol, String> helpers,
                                       Grammar.Symbol element) {
        String ret = helpers.get(element);
        if (ret != null) return ret;
        int index = helpers.size();
        do {
            ret = REPEAT_PREFIX + index++;
        } while (target.hasProductions(ret) ||
                 target.getTokenPatterns().containsKey(ret));
        helpers.put(element, ret);
        target.addProduction(new GrammarImpl.ProductionImpl(ret, element));
        target.addProduction(new GrammarImpl.ProductionImpl(ret,
            new GrammarImpl.Nonterminal(ret, Grammar.Symbol.SYM_INLINE),
            element));
        target.setRuleFlags(ret, GrammarView.RULE_SPLICE);
        return ret;
    }

    /**
     * Build the LALR(1) table of a grammar without anonymous terminals and
     * without optional or repeated symbols.
     */
    protected ParseTable buildTable(GrammarImpl g)
            throws InvalidGrammarException {
        Set<String> ignored = g.getIgnoredTokens();
        List<String> terminals = new ArrayList<String>();
        terminals.add(ParseTable.END);
        for (String name : g.getTokenPatterns().keySet()) {
            if (! ignored.contains(name)) terminals.add(name);
        }
        List<String> nonterminals = new ArrayList<String>();
        for (String name : g.getStartNames()) {
            nonterminals.add(START_PREFIX + name);
        }
        nonterminals.addAll(g.getProductionNames());
        Map<String, Integer> ids = new HashMap<String, Integer>();
        for (int i = 0; i < terminals.size(); i++) {
            ids.put(terminals.get(i), i);
        }
        for (int i = 0; i < nonterminals.size(); i++) {
            ids.put(nonterminals.get(i), terminals.size() + i);
        }

        List<ParseTable.Rule> rules = new ArrayList<ParseTable.Rule>();
        List<int[]> rhsList = new ArrayList<int[]>();
        List<Integer> lhsList = new ArrayList<Integer>();
        int numStarts = g.getStartNames().size();
        int[] startProductions = new int[numStarts];
        for (int i = 0; i < numStarts; i++) {
            String name = g.getStartNames().get(i);
            startProductions[i] = rules.size();
            rules.add(new ParseTable.Rule(START_PREFIX + name, null,
                                          new int[] { 0 }, 0, null));
            lhsList.add(ids.get(START_PREFIX + name));
            rhsList.add(new int[] { ids.get(name) });
        }
        for (String name : g.getProductionNames()) {
            for (Grammar.Production p : g.getProductions(name)) {
                List<Grammar.Symbol> syms = p.getSymbols();
                int[] rhs = new int[syms.size()];
                int[] flags = new int[syms.size()];
                for (int i = 0; i < rhs.length; i++) {
                    Grammar.Symbol s = syms.get(i);
                    if (! (s instanceof Grammar.NonterminalSymbol))
                        throw new InvalidGrammarException("Unresolved " +
                            "terminal " + s + " in rule " + name);
                    Integer id = ids.get(
                        ((Grammar.NonterminalSymbol) s).getReference());
                    if (id == null)
                        throw new InvalidGrammarException("Rule " + name +
                            " references undefined symbol " + s);
                    rhs[i] = id;
                    flags[i] = s.getFlags();
                }
                rules.add(new ParseTable.Rule(name, p.getAlias(), flags,
                                              g.getRuleFlags(name), p));
                lhsList.add(ids.get(name));
                rhsList.add(rhs);
            }
        }
        int[] lhs = new int[lhsList.size()];
        for (int i = 0; i < lhs.length; i++) lhs[i] = lhsList.get(i);

        Automaton a = new Automaton(terminals.size(), nonterminals.size(),
            lhs, rhsList.toArray(new int[rhsList.size()][]));
        a.computeFirstSets();
        int[] startStates = a.buildStates(startProductions);
        a.computeLookaheads(startStates);

        Map<Set<String>, TokenSource.Selection> selections =
            new HashMap<Set<String>, TokenSource.Selection>();
        List<ParseTable.State> states = new ArrayList<ParseTable.State>();
        for (int s = 0; s < a.getStateCount(); s++) {
            Map<String, ParseTable.Action> actions =
                new LinkedHashMap<String, ParseTable.Action>();
            Map<String, Integer> gotos = new LinkedHashMap<String, Integer>();
            for (Map.Entry<Integer, Integer> ent :
                     a.getTransitions(s).entrySet()) {
                int x = ent.getKey();
                if (x < terminals.size()) {
                    actions.put(terminals.get(x), new ParseTable.Action(
                        ParseTable.ActionType.SHIFT, ent.getValue()));
                } else {
                    gotos.put(nonterminals.get(x - terminals.size()),
                              ent.getValue());
                }
            }
            for (Map.Entry<Integer, BitSet> ent : a.getItems(s).entrySet()) {
                if (! a.isComplete(ent.getKey())) continue;
                int p = a.getItemProduction(ent.getKey());
                ParseTable.Action act = (p < numStarts) ?
                    new ParseTable.Action(ParseTable.ActionType.ACCEPT, p) :
                    new ParseTable.Action(ParseTable.ActionType.REDUCE, p);
                BitSet la = ent.getValue();
                for (int b = la.nextSetBit(0); b >= 0 && b < terminals.size();
                     b = la.nextSetBit(b + 1)) {
                    String term = terminals.get(b);
                    ParseTable.Action prev = actions.get(term);
                    if (prev == null) {
                        actions.put(term, act);
                    } else if (prev.equals(act)) {
                        continue;
                    } else if (prev.getType() == ParseTable.ActionType.SHIFT) {
                        String message = "Shift/reduce conflict in state " +
                            s + " on " + term + " with " +
                            describeRule(rules.get(p));
                        if (isStrict())
                            throw new InvalidGrammarException(message);
                        LOGGER.warning(message + "; shifting");
                    } else {
                        throw new InvalidGrammarException("Reduce/reduce " +
                            "conflict on " + term + " between " +
                            describeRule(rules.get(prev.getTarget())) +
                            " and " + describeRule(rules.get(p)));
                    }
                }
            }
            Set<String> acceptable = new TreeSet<String>(actions.keySet());
            acceptable.remove(ParseTable.END);
            TokenSource.Selection sel = selections.get(acceptable);
            if (sel == null) {
                sel = createSelection(g, acceptable);
                selections.put(acceptable, sel);
            }
            states.add(new ParseTable.State(s, actions, gotos, sel));
        }
        Map<String, Integer> starts = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < numStarts; i++) {
            starts.put(g.getStartNames().get(i), startStates[i]);
        }
        LOGGER.fine(String.format("Built LALR(1) table with %d states " +
            "and %d rules for start symbols %s", states.size(), rules.size(),
            starts.keySet()));
        return new ParseTable(states, rules, starts);
    }

    private static TokenSource.Selection createSelection(GrammarView g,
            Set<String> acceptable) {
        Map<String, TokenSource.TokenPattern> patterns =
            new LinkedHashMap<String, TokenSource.TokenPattern>();
        for (TokenSource.TokenPattern tp : g.getTokenPatterns().values()) {
            if (acceptable.contains(tp.getName()) ||
                    g.getIgnoredTokens().contains(tp.getName()))
                patterns.put(tp.getName(), tp);
        }
        return new Lexer.StandardSelection(patterns);
    }

    private static String describeRule(ParseTable.Rule rule) {
        if (rule.getSource() == null)
            return rule.getName() + ": " + rule.getName().substring(
                START_PREFIX.length());
        return Grammars.formatProduction(rule.getSource());
    }

}
