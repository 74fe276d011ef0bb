package net.ox.util.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.TokenSource;
import net.ox.api.parser.ValueTransform;
import net.ox.util.LogCapture;
import net.ox.util.config.DynamicConfiguration;
import org.junit.Test;

public class ParserCompilerTest {

    private static final Reducer FIRST = new Reducer() {
        public Object reduce(Object... children) {
            return children[0];
        }
    };

    private static int num(Object o) {
        if (o instanceof TokenSource.Token)
            return (Integer) ((TokenSource.Token) o).getValue();
        return (Integer) o;
    }

    private static CompiledLexer arithmeticLexer()
            throws InvalidGrammarException {
        return new LexerCompiler()
            .add("NUMBER", new Object[] {"[0-9]+", new ValueTransform() {
                public Object transform(String raw) {
                    return Integer.valueOf(raw);
                }
            }})
            .add("PLUS", "\\+")
            .add("MINUS", "-")
            .add("_WS", "\\s+")
            .compile();
    }

    private static RuleSet arithmeticRules() throws InvalidGrammarException {
        return new RuleSet()
            .rule("start", "expr")
            .rule("expr", "expr PLUS term", RuleSet.named("add",
                new Reducer() {
                    public Object reduce(Object... children) {
                        return num(children[0]) + num(children[2]);
                    }
                }))
            .rule("expr", "expr MINUS term", new Reducer() {
                public Object reduce(Object... children) {
                    return num(children[0]) - num(children[2]);
                }
            })
            .rule("expr", "term")
            .rule("term", "NUMBER | \"(\" expr \")\"");
    }

    @Test
    public void testGeneratedAliases() throws InvalidGrammarException {
        RuleSet rules = new RuleSet()
            .rule("start", "expr")
            .rule("expr", "expr PLUS NUMBER", RuleSet.named("Add!", FIRST))
            .rule("expr", "expr MINUS NUMBER | NUMBER MINUS", FIRST)
            .rule("expr", "NUMBER", FIRST)
            .rule("expr", "\"(\" expr \")\"")
            .rule("atom", "NUMBER", RuleSet.named("expr", FIRST));
        Map<String, Reducer> reducers = new HashMap<String, Reducer>();
        String src = new ParserCompiler().generateSource(rules, reducers);
        assertEquals(
            "?start : expr\n" +
            "?expr : expr PLUS NUMBER -> add_\n" +
            "      | expr MINUS NUMBER -> fn_expr\n" +
            "      | NUMBER MINUS -> fn_expr\n" +
            "      | NUMBER -> fn_expr_1\n" +
            "      | \"(\" expr \")\"\n" +
            "?atom : NUMBER -> expr_1\n", src);
        assertEquals(4, reducers.size());
        assertTrue(reducers.containsKey("add_"));
        assertTrue(reducers.containsKey("fn_expr"));
        assertTrue(reducers.containsKey("fn_expr_1"));
        assertTrue(reducers.containsKey("expr_1"));
    }

    @Test
    public void testCompileAndParse() throws InvalidGrammarException,
                                             ParsingException {
        Parser parser = new ParserCompiler().compile(arithmeticLexer(),
                                                     arithmeticRules());
        assertEquals(4, parser.parse("10 - (2 + 3) - 1"));
        assertEquals(6, parser.parse("1 + 2 + 3"));
    }

    @Test
    public void testTrailingOptional() throws InvalidGrammarException,
                                              ParsingException {
        CompiledLexer lexer = new LexerCompiler()
            .add("NUMBER", new Object[] {"[0-9]+", new ValueTransform() {
                public Object transform(String raw) {
                    return Integer.valueOf(raw);
                }
            }})
            .add("_WS", "\\s+")
            .compile();
        RuleSet rules = new RuleSet().rule("start",
            "\"[\" NUMBER (\",\" NUMBER)* [\",\"] \"]\"", new Reducer() {
                public Object reduce(Object... children) {
                    int sum = 0;
                    for (Object c : children) sum += num(c);
                    return sum;
                }
            });
        String src = new ParserCompiler().generateSource(rules,
            new HashMap<String, Reducer>());
        assertEquals("?start : \"[\" NUMBER (\",\" NUMBER)* [\",\"] \"]\"" +
            " -> fn_start\n", src);
        Parser parser = new ParserCompiler().compile(lexer, rules);
        assertEquals(6, parser.parse("[1, 2, 3,]"));
        assertEquals(4, parser.parse("[4]"));
    }

    @Test
    public void testLeadingGroup() throws InvalidGrammarException,
                                          ParsingException {
        RuleSet rules = new RuleSet().rule("start", "(PLUS | MINUS) NUMBER",
            new Reducer() {
                public Object reduce(Object... children) {
                    String sign = ((TokenSource.Token) children[0])
                        .getContent();
                    return "-".equals(sign) ? -num(children[1]) :
                        num(children[1]);
                }
            });
        String src = new ParserCompiler().generateSource(rules,
            new HashMap<String, Reducer>());
        assertEquals("?start : (PLUS | MINUS) NUMBER -> fn_start\n", src);
        Parser parser = new ParserCompiler().compile(arithmeticLexer(),
                                                     rules);
        assertEquals(-5, parser.parse("- 5"));
        assertEquals(7, parser.parse("+7"));
    }

    @Test
    public void testExplicitStart() throws InvalidGrammarException,
                                           ParsingException {
        Parser parser = new ParserCompiler().compile(arithmeticLexer(),
            arithmeticRules(), "term");
        Object res = parser.parse("(7 - 2)");
        assertEquals(5, res);
        try {
            parser.parse("7 - 2");
            fail("Expected a bare difference not to be a term");
        } catch (ParsingException exc) {
            // expected
        }
    }

    @Test
    public void testReducerErrorsBecomeParsingErrors()
            throws InvalidGrammarException {
        RuleSet rules = new RuleSet().rule("start", "NUMBER MINUS NUMBER",
            new Reducer() {
                public Object reduce(Object... children) {
                    throw new IllegalStateException("refusing to subtract");
                }
            });
        Parser parser = new ParserCompiler().compile(arithmeticLexer(),
                                                     rules);
        try {
            parser.parse("3 - 1");
            fail("Expected the reducer failure to be reported");
        } catch (ParsingException exc) {
            assertTrue(exc.getMessage().contains("refusing to subtract"));
        }
    }

    @Test
    public void testDebugLogging() throws InvalidGrammarException {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(ParserCompiler.DEBUG_KEY, "true");
        LogCapture log = new LogCapture("ParserCompiler");
        try {
            new ParserCompiler(config).compile(arithmeticLexer(),
                                               arithmeticRules());
        } finally {
            log.close();
        }
        assertTrue(log.contains(Level.INFO, "Generated grammar:\n?start"));
    }

    @Test(expected = InvalidGrammarException.class)
    public void testEmptyRules() throws InvalidGrammarException {
        new ParserCompiler().compile(arithmeticLexer(), new RuleSet());
    }

    @Test(expected = InvalidGrammarException.class)
    public void testInvalidRuleName() throws InvalidGrammarException {
        new RuleSet().rule("Expr", "NUMBER");
    }

}
