package net.ox.target.python;

import static net.ox.target.python.Py.S;
import static org.junit.Assert.assertEquals;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.PrintContext;
import org.junit.Test;

public class PrintingTest {

    private static Name n(String name) {
        return new Name(name);
    }

    @Test
    public void testLiterals() {
        assertEquals("1", S(1).getSource());
        assertEquals("2.5", S(2.5).getSource());
        assertEquals("'x'", S("x").getSource());
        assertEquals("True", S(true).getSource());
        assertEquals("None", S(null).getSource());
        assertEquals("-3", S(-3).getSource());
    }

    @Test
    public void testPrecedence() {
        assertEquals("(a + b) * c",
                     S("*", S("+", n("a"), n("b")), n("c")).getSource());
        assertEquals("a + b * c",
                     S("+", n("a"), S("*", n("b"), n("c"))).getSource());
        assertEquals("-(a + b)",
                     S("-", S("+", n("a"), n("b"))).getSource());
        assertEquals("not a == b",
                     S("not", S("==", n("a"), n("b"))).getSource());
        assertEquals("(not a) == b",
                     S("==", S("not", n("a")), n("b")).getSource());
        assertEquals("a and b or c",
                     S("or", S("and", n("a"), n("b")), n("c")).getSource());
        assertEquals("a and (b or c)",
                     S("and", n("a"), S("or", n("b"), n("c"))).getSource());
    }

    @Test
    public void testAssociativity() {
        assertEquals("a - b - c", S("-", n("a"), n("b"), n("c")).getSource());
        assertEquals("a - (b - c)",
                     S("-", n("a"), S("-", n("b"), n("c"))).getSource());
        assertEquals("a ** b ** c",
                     S("**", n("a"), n("b"), n("c")).getSource());
        assertEquals("(a ** b) ** c",
                     S("**", S("**", n("a"), n("b")), n("c")).getSource());
        assertEquals("(-1) ** 2", S("**", -1, 2).getSource());
    }

    @Test
    public void testMinimalParentheses() {
        Ast product = S("*", S("+", n("x"), 1), n("y"), 2);
        assertEquals("(x + 1) * y * 2", product.getSource());
        assertEquals("(x + 1) * y * 2", new BinOp(PyBinaryOp.MUL,
            (Expr) S("+", n("x"), 1), (Expr) S("*", n("y"), 2)).getSource());
    }

    @Test
    public void testAssociativeTies() {
        assertEquals("a + b + c",
                     S("+", n("a"), S("+", n("b"), n("c"))).getSource());
        assertEquals("a and b and c",
                     S("and", n("a"), S("and", n("b"), n("c"))).getSource());
        assertEquals("a | b | c",
                     S("|", n("a"), S("|", n("b"), n("c"))).getSource());
        assertEquals("a + (b - c)",
                     S("+", n("a"), S("-", n("b"), n("c"))).getSource());
        assertEquals("a * (b / c)",
                     S("*", n("a"), S("/", n("b"), n("c"))).getSource());
        assertEquals("a / (b * c)",
                     S("/", n("a"), S("*", n("b"), n("c"))).getSource());
    }

    @Test
    public void testComparisonsDoNotChain() {
        assertEquals("(a < b) < c",
                     S("<", S("<", n("a"), n("b")), n("c")).getSource());
        assertEquals("a < (b < c)",
                     S("<", n("a"), S("<", n("b"), n("c"))).getSource());
        assertEquals("x not in y", S("not in", n("x"), n("y")).getSource());
    }

    @Test
    public void testPrimaries() {
        Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
        kwargs.put("k", 2);
        Ast call = S("call", Arrays.asList(n("f"), 1), kwargs);
        assertEquals("f(1, k=2)", call.getSource());
        assertEquals("x.y", S(".", n("x"), "y").getSource());
        assertEquals("x['k']", S("[]", n("x"), "k").getSource());
        assertEquals("(a + b)(c)", S("call", S("+", n("a"), n("b")),
                                     n("c")).getSource());
        assertEquals("(1).real", S(".", 1, "real").getSource());
    }

    @Test
    public void testConditionalsAndLambdas() {
        assertEquals("a if c else b",
                     S("ifexp", n("c"), n("a"), n("b")).getSource());
        assertEquals("(a if c else b) + 1",
                     S("+", S("ifexp", n("c"), n("a"), n("b")), 1)
                         .getSource());
    }

    @Test
    public void testDisplays() {
        assertEquals("[1, 2]", Py.toExpr(Arrays.asList(1, 2)).getSource());
        assertEquals("[]", Py.toExpr(Collections.emptyList()).getSource());
        assertEquals("{'a': 1}",
            Py.toExpr(Collections.singletonMap("a", 1)).getSource());
        assertEquals("{}", Py.toExpr(Collections.emptyMap()).getSource());
        assertEquals("(1,)", S("tuple", 1).getSource());
        assertEquals("()", S("tuple").getSource());
        assertEquals("(1, 2)", S("tuple", 1, 2).getSource());
        assertEquals("{1}", S("set", 1).getSource());
    }

    @Test
    public void testSimpleStatements() {
        assertEquals("x = 1", S("=", n("x"), 1).getSource());
        assertEquals("return", S("return").getSource());
        assertEquals("return x + 1",
                     S("return", S("+", n("x"), 1)).getSource());
        assertEquals("pass", S("pass").getSource());
        assertEquals("break", S("break").getSource());
        assertEquals("continue", S("continue").getSource());
        assertEquals("f()", Py.toStmt(S("call", n("f"))).getSource());
    }

    @Test
    public void testFunction() {
        Ast f = S("def", "f", Arrays.asList("a", "b"),
                  S("return", S("+", n("a"), n("b"))));
        assertEquals("def f(a, b):\n" +
                     "    return a + b\n", f.getSource());
    }

    @Test
    public void testFunctionWithDefaults() {
        Ast f = S("def", Arrays.asList("f", Arrays.asList("a"),
                                       S("pass")),
                  Collections.singletonMap("k", 1));
        assertEquals("def f(a, k=1):\n" +
                     "    pass\n", f.getSource());
    }

    @Test
    public void testEmptyBodies() {
        assertEquals("def f():\n    pass\n",
                     S("def", "f", Collections.emptyList()).getSource());
        assertEquals("while x:\n    pass\n",
                     S("while", n("x"), Collections.emptyList())
                         .getSource());
    }

    @Test
    public void testElif() {
        Ast stmt = S("if", n("a"), Arrays.asList(S("pass")),
                     n("b"), Arrays.asList(S("break")),
                     Arrays.asList(S("continue")));
        assertEquals("if a:\n" +
                     "    pass\n" +
                     "elif b:\n" +
                     "    break\n" +
                     "else:\n" +
                     "    continue\n", stmt.getSource());
    }

    @Test
    public void testNesting() {
        Ast f = S("def", "f", Collections.emptyList(),
                  S("while", n("x"), Arrays.asList(
                      S("=", n("x"), S("-", n("x"), 1)),
                      S("if", n("x"), S("break")))),
                  S("return", n("x")));
        assertEquals("def f():\n" +
                     "    while x:\n" +
                     "        x = x - 1\n" +
                     "        if x:\n" +
                     "            break\n" +
                     "    return x\n", f.getSource());
        assertEquals("def f():\n" +
                     "  while x:\n" +
                     "    x = x - 1\n" +
                     "    if x:\n" +
                     "      break\n" +
                     "  return x\n", f.getSource(new PrintContext(2)));
    }

    @Test
    public void testForElse() {
        Ast loop = S("for", "i", S("call", n("range"), 3),
                     S("call", n("print"), n("i")), S("pass"));
        assertEquals("for i in range(3):\n" +
                     "    print(i)\n" +
                     "else:\n" +
                     "    pass\n", loop.getSource());
    }

    @Test
    public void testModuleBlock() {
        Block module = Py.toBlock(Arrays.asList(
            S("=", n("x"), 1),
            S("call", n("print"), n("x"))));
        assertEquals("x = 1\nprint(x)\n", module.getSource());
    }

}
