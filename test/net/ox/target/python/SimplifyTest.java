package net.ox.target.python;

import static net.ox.target.python.Py.S;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import net.ox.ast.Ast;
import net.ox.ast.StaticValue;
import org.junit.Test;

public class SimplifyTest {

    private static String simplified(Ast node) {
        return node.simplify().getSource();
    }

    @Test
    public void testConstantFolding() {
        Ast expr = S("+", 1, S("*", 2, 3));
        Ast res = expr.simplify();
        assertTrue(res instanceof Atom);
        assertEquals(7L, ((Atom) res).getValue());
        assertEquals("1 + 2 * 3", expr.getSource());
    }

    @Test
    public void testPartialFolding() {
        assertEquals("x + 6",
                     simplified(S("+", new Name("x"), S("*", 2, 3))));
        assertEquals("f(3)", simplified(S("call", new Name("f"),
                                          S("+", 1, 2))));
    }

    @Test
    public void testOperators() {
        assertEquals("0.5", simplified(S("/", 1, 2)));
        assertEquals("-2", simplified(S("//", -3, 2)));
        assertEquals("1", simplified(S("%", -3, 2)));
        assertEquals("1024", simplified(S("**", 2, 10)));
        assertEquals("'ab'", simplified(S("+", "a", "b")));
        assertEquals("'abab'", simplified(S("*", "ab", 2)));
        assertEquals("True", simplified(S("not", 0)));
        assertEquals("True", simplified(S("<", 1, 2.5)));
        assertEquals("-5", simplified(S("-", 5)));
        assertEquals("2", simplified(S("ifexp", false, 1, 2)));
    }

    @Test
    public void testUnfoldableExpressions() {
        assertEquals("1 / 0", simplified(S("/", 1, 0)));
        assertEquals("9223372036854775807 * 2",
                     simplified(S("*", Long.MAX_VALUE, 2)));
        assertEquals("'a' + 1", simplified(S("+", "a", 1)));
    }

    @Test
    public void testStaticValues() {
        StaticValue sv = S(5).getStaticValue();
        assertTrue(sv.isKnown());
        assertEquals(5L, sv.getValue());
        assertFalse(new Name("x").getStaticValue().isKnown());
        assertFalse(S("+", 1, 2).getStaticValue().isKnown());
    }

}
