package net.ox.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import java.util.Arrays;
import java.util.Collections;
import net.ox.target.python.ArgDef;
import net.ox.target.python.Atom;
import net.ox.target.python.BinOp;
import net.ox.target.python.Call;
import net.ox.target.python.Cmd;
import net.ox.target.python.Expr;
import net.ox.target.python.Name;
import net.ox.target.python.Py;
import net.ox.target.python.PyBinaryOp;
import org.json.JSONObject;
import org.junit.Test;

public class AstJsonTest {

    private static Ast roundTrip(Ast node) {
        String text = AstJson.toJSON(node).toString();
        return AstJson.fromJSON(Py.HIERARCHY, new JSONObject(text));
    }

    @Test
    public void testOperatorNode() {
        Ast node = new BinOp(PyBinaryOp.ADD, new Name("x"), new Atom(1L));
        JSONObject obj = AstJson.toJSON(node);
        assertEquals("BinOp", obj.getString("type"));
        assertEquals("ADD", obj.getString("tag"));
        assertEquals(2, obj.getJSONArray("children").length());
        Ast back = roundTrip(node);
        assertEquals(node, back);
        assertEquals("x + 1", back.getSource());
    }

    @Test
    public void testCall() {
        Ast node = new Call(new Name("f"),
            Collections.<Expr>singletonList(new Atom("a")),
            Arrays.asList(new ArgDef("k", new Atom(2L))));
        Ast back = roundTrip(node);
        assertEquals(node, back);
        assertEquals("f('a', k=2)", back.getSource());
    }

    @Test
    public void testEnumLeaf() {
        Ast node = new Cmd(Cmd.Kind.BREAK);
        assertEquals("BREAK", AstJson.toJSON(node).get("value"));
        assertEquals(node, roundTrip(node));
    }

    @Test
    public void testAttributes() {
        Ast node = new Name("x");
        node.setAttribute("line", 3L);
        node.setAttribute("origin", new Object());
        JSONObject obj = AstJson.toJSON(node);
        assertFalse(obj.getJSONObject("attrs").has("origin"));
        Ast back = roundTrip(node);
        assertEquals(3L, back.getAttribute("line"));
    }

    @Test
    public void testSyntaxTree() {
        Tree tree = new Tree("pair", new Token("a", "NAME"),
                             new Token(1L, "INT"));
        Ast back = roundTrip(tree);
        assertEquals(tree, back);
        assertEquals("(pair a 1)", back.getSource());
    }

    @Test(expected = ConstructionException.class)
    public void testUnknownType() {
        AstJson.fromJSON(Py.HIERARCHY,
                         new JSONObject("{\"type\": \"Nope\"}"));
    }

}
