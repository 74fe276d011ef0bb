package net.ox.util.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.TokenSource;
import net.ox.ast.Ast;
import net.ox.ast.Token;
import net.ox.ast.Tree;
import org.junit.BeforeClass;
import org.junit.Test;

public class GrammarsTest {

    private static String exprGrammar;

    @BeforeClass
    public static void beforeAll() throws IOException {
        InputStream in = GrammarsTest.class.getClassLoader()
            .getResourceAsStream("expr.grammar");
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            byte[] chunk = new byte[4096];
            for (;;) {
                int n = in.read(chunk);
                if (n < 0) break;
                buf.write(chunk, 0, n);
            }
        } finally {
            in.close();
        }
        exprGrammar = new String(buf.toByteArray(), StandardCharsets.UTF_8);
    }

    private static int toInt(Object o) {
        if (o instanceof TokenSource.Token)
            return Integer.parseInt(((TokenSource.Token) o).getContent());
        return (Integer) o;
    }

    private static final Reducer ADD = new Reducer() {
        public Object reduce(Object... children) {
            return toInt(children[0]) + toInt(children[1]);
        }
    };

    @Test
    public void testSplitAlternatives() throws InvalidGrammarException {
        assertEquals(Arrays.asList("a", "b \"|\" c", "(d | e)", "/x|y/"),
            Grammars.splitAlternatives("a | b \"|\" c | (d | e) | /x|y/"));
        assertEquals(Collections.singletonList("x y -> z"),
            Grammars.splitAlternatives("  x y -> z "));
    }

    @Test
    public void testSplitKeepsEdgeBrackets() throws InvalidGrammarException {
        assertEquals(Collections.singletonList("x [y]"),
            Grammars.splitAlternatives("x [y]"));
        assertEquals(Collections.singletonList("(a | b) c"),
            Grammars.splitAlternatives("(a | b) c"));
        assertEquals(Collections.singletonList("a (b)"),
            Grammars.splitAlternatives("a (b)"));
        assertEquals(Arrays.asList("[x] \"]\"", "(y)* /[(]/i"),
            Grammars.splitAlternatives("[x] \"]\" | (y)* /[(]/i"));
    }

    @Test
    public void testTreesWithoutReducers() throws InvalidGrammarException,
                                                  ParsingException {
        Parser parser = Grammars.compile(exprGrammar).createParser();
        Object res = parser.parse("1 + 2 + 3");
        assertTrue(res instanceof Tree);
        Tree tree = (Tree) res;
        assertEquals("add", tree.getName());
        assertEquals(2, tree.getChildren().size());
        assertEquals("(add (add 1 2) 3)", tree.getSource());
    }

    @Test
    public void testSingleValuesPassThrough() throws InvalidGrammarException,
                                                     ParsingException {
        Object res = Grammars.compile(exprGrammar).createParser()
            .parse(" 7 ");
        assertTrue(res instanceof Token);
        assertEquals("NUMBER", ((Token) res).getTokenType());
        assertEquals("7", ((Token) res).getContent());
    }

    @Test
    public void testReducers() throws InvalidGrammarException,
                                      ParsingException {
        Map<String, Reducer> reducers = Collections.singletonMap("add", ADD);
        Parser parser = Grammars.compile(exprGrammar).createParser(reducers);
        assertEquals(6, parser.parse("1 + 2 + 3"));
        assertEquals(10, parser.parse("1+2 + 3+4"));
    }

    @Test
    public void testNonPassingRule() throws InvalidGrammarException,
                                            ParsingException {
        Object res = Grammars.compile(
                "start : NAME NAME\n" +
                "NAME : /[a-z]+/\n" +
                "WS : / +/\n" +
                "%ignore WS\n").createParser().parse("ab cd");
        Tree tree = (Tree) res;
        assertEquals("start", tree.getName());
        assertEquals(2, tree.getChildren().size());
        for (Ast child : tree.getChildren()) {
            assertEquals("NAME", ((Token) child).getTokenType());
        }
        assertEquals("(start ab cd)", tree.getSource());
    }

    @Test
    public void testKeptLiterals() throws InvalidGrammarException,
                                          ParsingException {
        Parser plain = Grammars.compile(
            "start : \"(\" NAME \")\"\nNAME : /[a-z]+/\n").createParser();
        assertEquals("(start x)", ((Ast) plain.parse("(x)")).getSource());
        Parser keeping = Grammars.compile(
            "!start : \"(\" NAME \")\"\nNAME : /[a-z]+/\n").createParser();
        assertEquals("(start ( x ))",
                     ((Ast) keeping.parse("(x)")).getSource());
    }

    @Test
    public void testSyntaxErrors() throws InvalidGrammarException {
        Parser parser = Grammars.compile(exprGrammar).createParser();
        for (String input : Arrays.asList("1 +", "+ 1", "1 $ 2", "")) {
            try {
                parser.parse(input);
                fail("Expected " + input + " to be rejected");
            } catch (ParsingException exc) {
                // expected
            }
        }
    }

    @Test
    public void testUnknownAlias() throws InvalidGrammarException {
        try {
            Grammars.compile(exprGrammar).createParser(
                Collections.singletonMap("mul", ADD));
            fail("Expected binding to an unknown alias to fail");
        } catch (InvalidGrammarException exc) {
            assertTrue(exc.getMessage().contains("mul"));
        }
    }

    @Test(expected = InvalidGrammarException.class)
    public void testUndefinedSymbol() throws InvalidGrammarException {
        Grammars.compile("start : missing\n");
    }

    @Test(expected = InvalidGrammarException.class)
    public void testMalformedGrammar() throws InvalidGrammarException {
        Grammars.compile("start : ( NAME\nNAME : /x/\n");
    }

}
