package net.ox.operators;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class OperatorsTest {

    private static List<Object> triple(Object op, Object lhs, Object rhs) {
        return Arrays.asList(op, lhs, rhs);
    }

    @Test
    public void testSingleValue() {
        assertEquals(42, Operators.reduceChain(Arrays.<Object>asList(42)));
    }

    @Test
    public void testPrecedence() {
        Object res = Operators.reduceChain(Arrays.<Object>asList(
            1, "+", 2, "*", 3));
        assertEquals(triple("+", 1, triple("*", 2, 3)), res);
        res = Operators.reduceChain(Arrays.<Object>asList(
            1, "*", 2, "+", 3));
        assertEquals(triple("+", triple("*", 1, 2), 3), res);
    }

    @Test
    public void testLeftAssociative() {
        Object res = Operators.reduceChain(Arrays.<Object>asList(
            1, "-", 2, "-", 3));
        assertEquals(triple("-", triple("-", 1, 2), 3), res);
    }

    @Test
    public void testRightAssociative() {
        Object res = Operators.reduceChain(Arrays.<Object>asList(
            2, "**", 3, "**", 2));
        assertEquals(triple("**", 2, triple("**", 3, 2)), res);
    }

    @Test
    public void testComparisonsBindLooserThanArithmetic() {
        Object res = Operators.reduceChain(Arrays.<Object>asList(
            "a", "<", "b", "|", "c", "and", "d"));
        assertEquals(triple("and", triple("<", "a", triple("|", "b", "c")),
                            "d"), res);
    }

    @Test
    public void testCustomTable() {
        Map<String, Integer> prec = new HashMap<String, Integer>();
        prec.put("@", 2);
        prec.put("#", 1);
        Object res = Operators.reduceChain(
            Arrays.<Object>asList(1, "#", 2, "@", 3, "#", 4), prec,
            Collections.singleton("#"), Operators.TRIPLE);
        assertEquals(triple("#", 1, triple("#", triple("@", 2, 3), 4)),
                     res);
    }

    @Test
    public void testCustomBuilder() {
        Object res = Operators.reduceChain(
            Arrays.<Object>asList(1, "+", 2, "*", 3),
            Operators.DEFAULT_PRECEDENCE, Operators.DEFAULT_RIGHT_ASSOC,
            new ChainBuilder() {
                public Object build(Object op, Object lhs, Object rhs) {
                    return "(" + lhs + " " + op + " " + rhs + ")";
                }
            });
        assertEquals("(1 + (2 * 3))", res);
    }

    @Test
    public void testEvenChain() {
        try {
            Operators.reduceChain(Arrays.<Object>asList(1, "+"));
            fail("Expected an IllegalArgumentException");
        } catch (IllegalArgumentException exc) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyChain() {
        Operators.reduceChain(Collections.emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOperator() {
        Operators.reduceChain(Arrays.<Object>asList(1, "<=>", 2));
    }

}
