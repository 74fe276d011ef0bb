package net.ox.target.python;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import net.ox.ast.Wrapper;
import net.ox.api.parser.ParsingException;
import org.junit.Test;

public class WrapperTest {

    @Test
    public void testArithmetic() {
        assertEquals("py['1 + 1']", Py.py(1).add(1).toString());
        assertEquals("py['x * (y - 1)']",
                     Py.name("x").mul(Py.name("y").sub(1)).toString());
        assertEquals("py['-x ** 2']",
                     Py.name("x").pow(2).neg().toString());
        assertEquals("py['x // 2 % 3']",
                     Py.name("x").floorDiv(2).mod(3).toString());
    }

    @Test
    public void testComparisons() {
        assertEquals("py['x < 1']", Py.name("x").lt(1).toString());
        assertEquals("py['x != None']", Py.name("x").ne(null).toString());
    }

    @Test
    public void testAttributesAndCalls() {
        assertEquals("py['(1).foo']", Py.py(1).attr("foo").toString());
        assertEquals("py['(x + y).method()']", Py.name("x")
            .add(Py.name("y")).attr("method").call().toString());
        assertEquals("py['f(1, k=2)']", Py.name("f").call(
            Arrays.asList(1), Collections.singletonMap("k", 2)).toString());
        assertEquals("py['d['k']']", Py.name("d").item("k").toString());
    }

    @Test
    public void testBooleanOperators() {
        PyWrapper x = Py.name("x");
        PyWrapper both = (PyWrapper) x.and(Py.name("y"));
        assertEquals("py['x and y or not z']",
                     both.or(Py.name("z").not()).toString());
        assertEquals("py['1 in x']", x.contains(1).toString());
        assertEquals("py['x if c else None']",
                     x.ifElse(Py.name("c"), null).toString());
    }

    @Test
    public void testOperandsAreCopied() {
        PyWrapper x = Py.name("x");
        Wrapper sum = x.add(x);
        assertEquals("py['x + x']", sum.toString());
        assertNull(x.unwrap().getParent());
        assertNotSame(x.unwrap(), x.unwrap());
        assertEquals(x, Py.name("x"));
    }

    @Test
    public void testParse() throws ParsingException {
        Wrapper w = Py.parse("a.b(c)[0]");
        assertEquals("py['a.b(c)[0]']", w.toString());
        assertTrue(w.unwrap() instanceof GetItem);
    }

}
