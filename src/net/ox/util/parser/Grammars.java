package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import net.ox.api.parser.CompiledGrammar;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.GrammarView;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.ast.Ast;
import net.ox.util.Formats;
import net.ox.util.config.Configuration;

/**
 * Reading and compiling grammar text.
 * A grammar consists of lines of the following forms:
 * <pre>
 * rule : alternative | alternative -&gt; alias | ...
 * ?rule : ...        (pass single values through)
 * !rule : ...        (keep anonymous literals)
 * TOKEN : "literal" | /regex/flags | ...
 * TOKEN.2 : ...      (token priority)
 * %ignore TOKEN
 * // comment
 * </pre>
 * Alternatives consist of rule and token names, string literals, regular
 * expressions, groups "( ... )", optional groups "[ ... ]", and the
 * quantifiers "?", "*", and "+". Alternatives may continue on following
 * lines that begin with "|".
 */
public final class Grammars {

    private static class MetaGrammar extends GrammarImpl {

        public static final String START = "grammar";

        public static final String EXPANSIONS = "expansions";

        public static final CompiledGrammar COMPILED_INSTANCE;

        static {
            try {
                COMPILED_INSTANCE = new LALRCompiler(Configuration.NULL)
                    .compile(new MetaGrammar());
            } catch (InvalidGrammarException exc) {
                throw new RuntimeException(exc);
            }
        }

        public MetaGrammar() {
            /* Tokens */
            pattern("CONT", "(?:(?://[^\\n]*)?\\r?\\n[ \\t]*)+\\|");
            pattern("NL", "(?:(?://[^\\n]*)?\\r?\\n[ \\t]*)+");
            pattern("WS", "[ \\t\\f]+");
            terminal("COLON", ":");
            terminal("VBAR", "|");
            terminal("ARROW", "->");
            terminal("LPAR", "(");
            terminal("RPAR", ")");
            terminal("LSQB", "[");
            terminal("RSQB", "]");
            terminal("QMARK", "?");
            terminal("STAR", "*");
            terminal("PLUS", "+");
            terminal("BANG", "!");
            terminal("DOT", ".");
            terminal("IGNORE", "%ignore");
            pattern("NUMBER", "-?[0-9]+");
            pattern("RULE", "[_a-z][_a-z0-9]*");
            pattern("TOKEN", "_*[A-Z][_A-Z0-9]*");
            pattern("STRING", "\"(?:[^\"\\\\\\n]|\\\\.)*\"");
            pattern("REGEXP", "/(?![/*])(?:[^/\\\\\\n]|\\\\.)+/[imsux]*");
            addIgnoredToken("WS");
            /* File structure */
            prod(START, nt("line", Symbol.SYM_INLINE | Symbol.SYM_OPTIONAL |
                                   Symbol.SYM_REPEAT));
            prod("line", nt("NL", Symbol.SYM_DISCARD));
            prod("line", nt("item", Symbol.SYM_INLINE),
                 nt("NL", Symbol.SYM_DISCARD));
            prod("item", nt("rule_def"));
            prod("item", nt("token_def"));
            prod("item", nt("ignore_def"));
            setRuleFlags("line", RULE_SPLICE);
            setRuleFlags("item", RULE_SPLICE);
            /* Definitions */
            prod("rule_def", nt("RULE"), nt("COLON", Symbol.SYM_DISCARD),
                 nt("expansions"));
            prod("rule_def", nt("modifiers"), nt("RULE"),
                 nt("COLON", Symbol.SYM_DISCARD), nt("expansions"));
            prod("modifiers", nt("QMARK"));
            prod("modifiers", nt("BANG"));
            prod("modifiers", nt("QMARK"), nt("BANG"));
            prod("modifiers", nt("BANG"), nt("QMARK"));
            prod("token_def", nt("TOKEN"), nt("COLON", Symbol.SYM_DISCARD),
                 nt("expansions"));
            prod("token_def", nt("TOKEN"), nt("DOT", Symbol.SYM_DISCARD),
                 nt("NUMBER"), nt("COLON", Symbol.SYM_DISCARD),
                 nt("expansions"));
            prod("ignore_def", nt("IGNORE", Symbol.SYM_DISCARD),
                 nt("expansions"));
            /* Expansions */
            prod("expansions", nt("alias"));
            prod("expansions", nt("expansions", Symbol.SYM_INLINE),
                 nt("VBAR", Symbol.SYM_DISCARD), nt("alias"));
            prod("expansions", nt("expansions", Symbol.SYM_INLINE),
                 nt("CONT", Symbol.SYM_DISCARD), nt("alias"));
            prod("alias", nt("expansion"));
            prod("alias", nt("expansion"), nt("ARROW", Symbol.SYM_DISCARD),
                 nt("RULE"));
            prod("expansion", nt("expr", Symbol.SYM_OPTIONAL |
                                         Symbol.SYM_REPEAT));
            prod("expr", nt("atom", Symbol.SYM_INLINE));
            prod("expr", nt("atom", Symbol.SYM_INLINE), nt("QMARK"));
            prod("expr", nt("atom", Symbol.SYM_INLINE), nt("STAR"));
            prod("expr", nt("atom", Symbol.SYM_INLINE), nt("PLUS"));
            prod("atom", nt("group"));
            prod("atom", nt("maybe"));
            prod("atom", nt("RULE"));
            prod("atom", nt("TOKEN"));
            prod("atom", nt("STRING"));
            prod("atom", nt("REGEXP"));
            setRuleFlags("atom", RULE_SPLICE);
            prod("group", nt("LPAR", Symbol.SYM_DISCARD), nt("expansions"),
                 nt("RPAR", Symbol.SYM_DISCARD));
            prod("maybe", nt("LSQB", Symbol.SYM_DISCARD), nt("expansions"),
                 nt("RSQB", Symbol.SYM_DISCARD));
            addStartName(START);
            addStartName(EXPANSIONS);
        }

        private void terminal(String name, String content) {
            addTokenPattern(createTokenPattern(name,
                createTerminal(content, 0), 0, null));
        }
        private void pattern(String name, String regex) {
            addTokenPattern(createTokenPattern(name,
                createTerminal(Pattern.compile(regex), 0), 0, null));
        }

        private static Symbol nt(String reference) {
            return new Nonterminal(reference, 0);
        }
        private static Symbol nt(String reference, int flags) {
            return new Nonterminal(reference, flags);
        }

        private void prod(String name, Symbol... symbols) {
            addProduction(new ProductionImpl(name, symbols));
        }

    }

    private Grammars() {}

    public static CompiledGrammar getMetaGrammar() {
        return MetaGrammar.COMPILED_INSTANCE;
    }

    /**
     * Parse grammar text into a (mutable, unvalidated) grammar.
     * The default start symbol is the first of starts, or "start" if it is
     * defined, or the first rule.
     */
    public static GrammarImpl parseGrammar(String text, String... starts)
            throws InvalidGrammarException {
        Object tree;
        try {
            tree = getMetaGrammar().createParser().parse(text + "\n");
        } catch (ParsingException exc) {
            throw new InvalidGrammarException("Invalid grammar text: " +
                                              exc.getMessage(), exc);
        }
        try {
            return new GrammarReader(Arrays.asList(starts))
                .read((Parser.ParseTree) tree);
        } catch (MappingException exc) {
            throw new InvalidGrammarException(exc.getMessage(), exc);
        }
    }

    /**
     * Parse and compile grammar text.
     */
    public static CompiledGrammarImpl compile(String text, String... starts)
            throws InvalidGrammarException {
        return compile(Configuration.DEFAULT, text, starts);
    }
    public static CompiledGrammarImpl compile(Configuration config,
            String text, String... starts) throws InvalidGrammarException {
        return new LALRCompiler(config).compile(parseGrammar(text, starts),
                                                text);
    }

    /**
     * Split the alternatives of a rule body at its top-level bars.
     * Bars inside groups, string literals, and regular expressions are
     * left alone; the alternatives are returned as (trimmed) text.
     */
    public static List<String> splitAlternatives(String body)
            throws InvalidGrammarException {
        Object tree;
        try {
            tree = getMetaGrammar().createParser().parse(body,
                MetaGrammar.EXPANSIONS);
        } catch (ParsingException exc) {
            throw new InvalidGrammarException("Invalid rule alternatives " +
                Formats.formatString(body) + ": " + exc.getMessage(), exc);
        }
        List<String> ret = new ArrayList<String>();
        StringBuilder cur = new StringBuilder();
        int depth = 0, i = 0, n = body.length();
        while (i < n) {
            char c = body.charAt(i);
            char next = (i + 1 < n) ? body.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                // Comments are dropped.
                while (i < n && body.charAt(i) != '\n') i++;
                continue;
            } else if (c == '"' || c == '/' && next != '*') {
                int end = skipQuoted(body, i, c);
                cur.append(body, i, end);
                i = end;
                continue;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '|' && depth == 0) {
                ret.add(cur.toString().trim());
                cur.setLength(0);
                i++;
                continue;
            }
            cur.append(c);
            i++;
        }
        ret.add(cur.toString().trim());
        if (ret.size() != ((Ast) tree).getChildren().size())
            throw new InvalidGrammarException("Cannot split rule " +
                "alternatives " + Formats.formatString(body));
        return ret;
    }

    /* Return the index just past the literal opened by delim at start. */
    private static int skipQuoted(String text, int start, char delim) {
        int i = start + 1, n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == delim) {
                i++;
                break;
            } else {
                i++;
            }
        }
        return Math.min(i, n);
    }

    /**
     * Compile a programmatically assembled grammar.
     */
    public static CompiledGrammarImpl compile(GrammarView grammar)
            throws InvalidGrammarException {
        return new LALRCompiler().compile(grammar);
    }

    public static String formatWithSymbolFlags(String base, int flags) {
        StringBuilder sb = new StringBuilder();
        if ((flags & Grammar.Symbol.SYM_INLINE  ) != 0) sb.append('^');
        if ((flags & Grammar.Symbol.SYM_DISCARD ) != 0) sb.append('~');
        sb.append(base);
        if ((flags & Grammar.Symbol.SYM_OPTIONAL) != 0) sb.append('?');
        if ((flags & Grammar.Symbol.SYM_REPEAT  ) != 0) sb.append('+');
        flags &= ~Grammar.Symbol.SYM_ALL;
        if (flags != 0)
            sb.append("[0x").append(Integer.toHexString(flags)).append("]");
        return sb.toString();
    }

    public static String formatProduction(Grammar.Production prod) {
        StringBuilder sb = new StringBuilder(prod.getName()).append(':');
        List<Grammar.Symbol> syms = prod.getSymbols();
        for (Grammar.Symbol s : syms) sb.append(' ').append(s);
        if (syms.isEmpty()) sb.append(" <empty>");
        if (prod.getAlias() != null)
            sb.append(" -> ").append(prod.getAlias());
        return sb.toString();
    }

}
