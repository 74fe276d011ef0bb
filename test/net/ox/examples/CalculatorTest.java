package net.ox.examples;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.logging.Level;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.ParsingException;
import net.ox.util.LogCapture;
import org.junit.Before;
import org.junit.Test;

public class CalculatorTest {

    private static final double EPSILON = 1e-9;

    private Calculator calc;

    @Before
    public void setUp() {
        calc = new Calculator();
    }

    @Test
    public void testArithmetic() throws ParsingException {
        assertEquals(3.0, calc.eval("1 + 2"), EPSILON);
        assertEquals(6.0, calc.eval("2 * 3"), EPSILON);
        assertEquals(9.0, calc.eval("(1 + 2) * 3"), EPSILON);
        assertEquals(7.0, calc.eval("1 + 2 * 3"), EPSILON);
        assertEquals(5.0, calc.eval("8 - 2 - 1"), EPSILON);
        assertEquals(2.5, calc.eval("10 / 4"), EPSILON);
    }

    @Test
    public void testPower() throws ParsingException {
        assertEquals(9.0, calc.eval("2^3 + 1"), EPSILON);
        assertEquals(512.0, calc.eval("2^3^2"), EPSILON);
    }

    @Test
    public void testParseShape() throws ParsingException {
        assertEquals(Arrays.asList("+", 1.0, Arrays.asList("*", 2.0, "x")),
                     Calculator.parse("1 + 2 * x"));
        assertEquals(Collections.singletonMap("y", 1.5),
                     Calculator.parse("y = 1.5"));
    }

    @Test
    public void testVariables() throws ParsingException {
        calc.getEnvironment().put("x", 2.0);
        assertEquals(3.0, calc.eval("1 + x"), EPSILON);
        assertEquals(6.0, calc.eval("y = x * 3"), EPSILON);
        Map<String, Double> env = calc.getEnvironment();
        assertEquals(Double.valueOf(6.0), env.get("y"));
        assertEquals(7.0, calc.eval("y + 1"), EPSILON);
    }

    @Test
    public void testAssignment() throws ParsingException {
        assertEquals(2.0, calc.eval("x = 2"), EPSILON);
        assertEquals(Collections.singletonMap("x", 2.0),
                     calc.getEnvironment());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUndefinedVariable() throws ParsingException {
        calc.eval("1 + nope");
    }

    @Test
    public void testSyntaxError() {
        try {
            calc.eval("1 +");
        } catch (ParsingException exc) {
            assertTrue(exc.getMessage() != null);
            return;
        }
        throw new AssertionError("Expected a ParsingException");
    }

    @Test
    public void testCompileFailureIsLogged() {
        InvalidGrammarException cause = new InvalidGrammarException("bad");
        LogCapture log = new LogCapture("Calculator");
        RuntimeException exc;
        try {
            exc = Calculator.compileFailure(cause);
        } finally {
            log.close();
        }
        assertTrue(exc.getCause() == cause);
        assertTrue(log.contains(Level.SEVERE,
                                "Cannot compile calculator parser"));
    }

}
