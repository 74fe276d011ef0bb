package net.ox.ast;

import static net.ox.target.python.Py.S;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import net.ox.target.python.Atom;
import net.ox.target.python.BinOp;
import net.ox.target.python.Name;
import net.ox.target.python.Py;
import net.ox.target.python.PyBinaryOp;
import net.ox.target.python.PyNode;
import net.ox.util.LogCapture;
import org.junit.Test;

public class HierarchyTest {

    private static final SExprConstructor DUMMY = new SExprConstructor() {
        public Ast construct(Hierarchy h, List<?> args,
                             Map<String, ?> kwargs) {
            return new Name("dummy");
        }
    };

    @Test
    public void testConstructBySymbol() {
        Ast sum = S("+", 1, S("*", Py.name("x"), 2));
        assertTrue(sum instanceof BinOp);
        assertEquals("1 + x * 2", sum.getSource());
        assertEquals(new Atom(3L), S(3));
        assertEquals("-x", S("-", Py.name("x")).getSource());
    }

    @Test
    public void testDuplicateRegistrationKeepsFirst() {
        SExprConstructor old = Py.HIERARCHY.getConstructor("+");
        LogCapture log = new LogCapture("Hierarchy", Level.FINE);
        try {
            assertFalse(Py.HIERARCHY.register("+", DUMMY));
        } finally {
            log.close();
        }
        assertTrue(log.contains(Level.FINE,
            "Ignoring duplicate registration of symbol +"));
        assertSame(old, Py.HIERARCHY.getConstructor("+"));
        assertTrue(S("+", 1, 2) instanceof BinOp);
    }

    @Test
    public void testNewSymbol() {
        assertTrue(Py.HIERARCHY.register("dummy-test-symbol", DUMMY));
        assertEquals("dummy", S("dummy-test-symbol", 1).getSource());
    }

    @Test(expected = InvalidHeadException.class)
    public void testUnknownHead() {
        S("nope", 1);
    }

    @Test(expected = CoercionException.class)
    public void testUncoercibleValue() {
        Py.HIERARCHY.coerce(new Object());
    }

    @Test
    public void testCoercion() {
        assertEquals(new Atom(null), Py.HIERARCHY.coerce(null));
        assertEquals("[1, 'a']",
            Py.HIERARCHY.coerce(java.util.Arrays.asList(1, "a")).getSource());
        try {
            Py.HIERARCHY.coerce(new Token("x"));
            fail("Expected a CoercionException");
        } catch (CoercionException exc) {
            // expected
        }
    }

    @Test(expected = ConstructionException.class)
    public void testKeywordName() {
        new Name("if");
    }

    @Test(expected = ConstructionException.class)
    public void testBooleanBinOp() {
        new BinOp(PyBinaryOp.AND, new Name("x"), new Name("y"));
    }

    @Test(expected = OwnershipException.class)
    public void testSharedChild() {
        Name n = new Name("x");
        S("+", n, n);
    }

    @Test
    public void testSecondParent() {
        Name n = new Name("x");
        Ast first = S("+", n, 1);
        assertSame(first, n.getParent());
        try {
            S("*", n, 2);
            fail("Expected an OwnershipException");
        } catch (OwnershipException exc) {
            // expected
        }
    }

    @Test
    public void testSetChild() {
        Name y = new Name("y");
        BinOp sum = new BinOp(PyBinaryOp.ADD, new Name("x"), y);
        Name z = new Name("z");
        sum.setChild("rhs", z);
        assertEquals("x + z", sum.getSource());
        assertSame(sum, z.getParent());
        assertEquals(null, y.getParent());
        try {
            sum.setChild("lhs", z);
            fail("Expected an OwnershipException");
        } catch (OwnershipException exc) {
            // expected
        }
        try {
            sum.setChild("lhs", new Token("x"));
            fail("Expected a ConstructionException");
        } catch (ConstructionException exc) {
            // expected
        }
    }

    @Test
    public void testLateCoercion() {
        Hierarchy.Coercion chars = new Hierarchy.Coercion() {
            public Ast coerce(Object value) {
                return new Atom(String.valueOf(value));
            }
        };
        assertTrue(Py.HIERARCHY.registerCoercion(Character.class, chars));
        assertFalse(Py.HIERARCHY.registerCoercion(Character.class, chars));
        assertEquals("'c'", Py.HIERARCHY.coerce('c').getSource());
    }

    @Test
    public void testTypeLookup() {
        assertSame(BinOp.TYPE, Py.HIERARCHY.getType("BinOp"));
        assertTrue(Py.HIERARCHY.getTypes(AstType.Kind.LEAF)
                   .contains(Atom.TYPE));
        assertFalse(Py.HIERARCHY.getTypes(AstType.Kind.LEAF)
                    .contains(BinOp.TYPE));
    }

    @Test(expected = AbstractInstantiationException.class)
    public void testAbstractType() {
        PyNode.EXPR.create();
    }

    @Test(expected = DeclarationException.class)
    public void testNonRootHierarchy() {
        Hierarchy.builder(PyNode.EXPR);
    }

}
