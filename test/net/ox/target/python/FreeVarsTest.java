package net.ox.target.python;

import static net.ox.target.python.Py.S;
import static org.junit.Assert.assertEquals;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import net.ox.api.parser.ParsingException;
import net.ox.ast.Tree;
import org.junit.Test;

public class FreeVarsTest {

    private static Name n(String name) {
        return new Name(name);
    }

    private static Set<String> set(String... names) {
        return new HashSet<String>(Arrays.asList(names));
    }

    @Test
    public void testExpressions() {
        assertEquals(set("x", "y"), S("+", n("x"), n("y")).getFreeVars());
        assertEquals(set(), S(1).getFreeVars());
        assertEquals(set("obj"), S(".", n("obj"), "attr").getFreeVars());
        assertEquals(set("f", "y"), S("call", Arrays.asList(n("f")),
            Collections.singletonMap("k", n("y"))).getFreeVars());
    }

    @Test
    public void testExcludeAndInclude() {
        assertEquals(set("y", "z"), S("+", n("x"), n("y")).getFreeVars(
            set("x"), set("z")));
    }

    @Test
    public void testLambda() throws ParsingException {
        assertEquals(set("y"),
                     PyGrammar.parse("lambda x: x + y").getFreeVars());
        assertEquals(set("w"),
                     PyGrammar.parse("lambda x, y: x + y + w")
                         .getFreeVars());
        Lambda withDefault = new Lambda(
            new Tree("args", n("x"), new ArgDef("k", n("z"))),
            new BinOp(PyBinaryOp.ADD, n("x"), n("k")));
        assertEquals(set("z"), withDefault.getFreeVars());
        assertEquals(set(),
                     PyGrammar.parse("lambda x: lambda y: x + y")
                         .getFreeVars());
    }

    @Test
    public void testFunctionParameters() {
        assertEquals(set("b"), S("def", "f", Arrays.asList("a"),
            S("return", S("+", n("a"), n("b")))).getFreeVars());
    }

    @Test
    public void testRecursiveFunction() {
        assertEquals(set(), S("def", "f", Arrays.asList("k"),
            S("return", S("call", n("f"), n("k")))).getFreeVars());
    }

    @Test
    public void testFunctionLocals() {
        assertEquals(set("u"), S("def", "f", Collections.emptyList(),
            S("=", n("t"), n("u")),
            S("return", n("t"))).getFreeVars());
        assertEquals(set("xs"), S("def", "f", Collections.emptyList(),
            S("for", "i", n("xs"), S("pass")),
            S("return", n("i"))).getFreeVars());
    }

    @Test
    public void testDefaultsBelongToEnclosingScope() {
        assertEquals(set("d"), S("def", Arrays.asList("f",
            Arrays.asList("d"), S("return", n("d"))),
            Collections.singletonMap("k", n("d"))).getFreeVars());
    }

    @Test
    public void testFor() {
        assertEquals(set("xs", "z"), S("for", "x", n("xs"),
            S("+", n("x"), n("z"))).getFreeVars());
    }

    @Test
    public void testModuleLevelBlock() {
        Block module = Py.toBlock(Arrays.asList(
            S("=", n("x"), 1),
            S("call", n("print"), n("x"))));
        assertEquals(set("print", "x"), module.getFreeVars());
    }

}
