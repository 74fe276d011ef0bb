package net.ox.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class TreeTest {

    @Test
    public void testBoxing() {
        Token name = new Token("x", "NAME");
        Tree t = Tree.of("call", Arrays.asList(name, 5, "s"));
        assertSame(name, t.getChildren().get(0));
        Token boxed = (Token) t.getChildren().get(1);
        assertEquals(Token.VALUE_TYPE, boxed.getTokenType());
        assertEquals(5, boxed.getValue());
        assertEquals("(call x 5 s)", t.getSource());
        assertSame(t, name.getParent());
    }

    @Test
    public void testNesting() {
        Tree inner = new Tree("add", new Token("1"), new Token("2"));
        Tree outer = new Tree("neg", inner);
        assertEquals("(neg (add 1 2))", outer.getSource());
        assertEquals("add", inner.getName());
        assertSame(Syntax.ROOT, outer.getType().getRoot());
    }

    @Test
    public void testCopyAndEquality() {
        Tree t = new Tree("pair", new Token(1L, "INT"), new Token(2L, "INT"));
        t.setAttribute("line", 3);
        Ast c = t.copy();
        assertNotSame(t, c);
        assertEquals(t, c);
        assertNull(c.getParent());
        assertEquals(3, c.getAttribute("line"));
        assertTrue(! t.equals(new Tree("pair", new Token(1L, "INT"))));
        assertTrue(! new Token(1L, "INT").equals(new Token(1L, "FLOAT")));
    }

    @Test
    public void testRelease() {
        Token a = new Token("a");
        Tree t = new Tree("x", a);
        List<Ast> released = t.release();
        assertEquals(Arrays.<Ast>asList(a), released);
        assertNull(a.getParent());
        assertTrue(t.getChildren().isEmpty());
        Tree other = new Tree("y", a);
        assertSame(other, a.getParent());
    }

    @Test(expected = ConstructionException.class)
    public void testNullTag() {
        new Tree(null);
    }

}
