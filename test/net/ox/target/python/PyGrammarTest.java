package net.ox.target.python;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.logging.Level;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.ParsingException;
import net.ox.util.LogCapture;
import org.junit.Test;

public class PyGrammarTest {

    private static String roundTrip(String source) throws ParsingException {
        return PyGrammar.parse(source).getSource();
    }

    private static void assertRoundTrip(String source)
            throws ParsingException {
        assertEquals(source, roundTrip(source));
    }

    private static void assertRejected(String source) {
        try {
            PyGrammar.parse(source);
            fail("Expected " + source + " to be rejected");
        } catch (ParsingException exc) {
            // expected
        }
    }

    @Test
    public void testArithmetic() throws ParsingException {
        assertRoundTrip("a + b * c");
        assertRoundTrip("(a + b) * c");
        assertRoundTrip("a - (b - c)");
        assertRoundTrip("-x ** 2");
        assertRoundTrip("2 ** 3 ** 2");
        assertRoundTrip("(2 ** 3) ** 2");
        assertEquals("a + b", roundTrip("  a+b  "));
    }

    @Test
    public void testBooleans() throws ParsingException {
        assertRoundTrip("not a == b");
        assertRoundTrip("a and b or c");
        assertRoundTrip("a or b or c");
        assertRoundTrip("not not x");
    }

    @Test
    public void testComparisons() throws ParsingException {
        assertRoundTrip("x not in y");
        assertRoundTrip("x is not None");
        assertEquals("(a < b) < c", roundTrip("a < b < c"));
    }

    @Test
    public void testPrimaries() throws ParsingException {
        assertRoundTrip("f(x, k=1)[0].y");
        assertRoundTrip("f()");
        assertRoundTrip("a.b.c");
        assertRoundTrip("(a if b else c).d");
        assertRoundTrip("(lambda: 1)()");
        assertTrue(PyGrammar.parse("a.b(c)[0]") instanceof GetItem);
    }

    @Test
    public void testLambdaAndTernary() throws ParsingException {
        assertRoundTrip("lambda x, y: x if y else None");
        assertRoundTrip("lambda: 1");
        assertTrue(PyGrammar.parse("lambda x: x") instanceof Lambda);
    }

    @Test
    public void testDisplays() throws ParsingException {
        assertRoundTrip("[1, 2.5, 'a']");
        assertRoundTrip("[]");
        assertRoundTrip("{}");
        assertRoundTrip("{1: 2}");
        assertRoundTrip("{1, 2}");
        assertRoundTrip("(1,)");
        assertRoundTrip("()");
        assertRoundTrip("(1, 2)");
        assertEquals("'a'", roundTrip("\"a\""));
    }

    @Test
    public void testStructuralRoundTrip() throws ParsingException {
        Expr[] nodes = {
            new BinOp(PyBinaryOp.ADD, new Name("x"), new Atom(1L)),
            new BinOp(PyBinaryOp.MUL, new BinOp(PyBinaryOp.MUL,
                new BinOp(PyBinaryOp.ADD, new Name("x"), new Atom(1L)),
                new Name("y")), new Atom(2L)),
            new BinOp(PyBinaryOp.SUB, new Name("a"), new BinOp(
                PyBinaryOp.SUB, new Name("b"), new Name("c"))),
            new Or(new And(new Name("a"), new Name("b")),
                   new UnaryOp(PyUnaryOp.NOT, new Name("c"))),
            new Call(new GetAttr(new Name("o"), "m"), new Atom("s"))
        };
        for (Expr node : nodes) {
            assertEquals(node, PyGrammar.parse(node.getSource()));
        }
    }

    @Test
    public void testKeywordsAndNames() throws ParsingException {
        assertRoundTrip("True");
        assertTrue(PyGrammar.parse("None") instanceof Atom);
        Expr e = PyGrammar.parse("Nonesuch");
        assertTrue(e instanceof Name);
        assertEquals("Nonesuch", e.getSource());
        assertRejected("if");
    }

    @Test
    public void testSyntaxErrors() {
        assertRejected("1 +");
        assertRejected("a b");
        assertRejected("1.foo");
        assertRejected("f(");
        assertRejected("$");
    }

    @Test
    public void testCompileFailureIsLogged() {
        InvalidGrammarException cause = new InvalidGrammarException("bad");
        LogCapture log = new LogCapture("PyGrammar");
        RuntimeException exc;
        try {
            exc = PyGrammar.compileFailure(cause);
        } finally {
            log.close();
        }
        assertTrue(exc.getCause() == cause);
        assertTrue(log.contains(Level.SEVERE,
                                "Cannot compile expression parser"));
    }

}
