package net.ox.operators;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Precedence tables and operator chain reduction.
 */
public final class Operators {

    /**
     * Precedences of the usual infix operators, keyed by their symbols.
     * The scale follows Python: boolean operators bind loosest, then
     * comparisons, bitwise operators, shifts, additive, multiplicative, and
     * finally exponentiation.
     */
    public static final Map<String, Integer> DEFAULT_PRECEDENCE;

    /**
     * The right-associative members of DEFAULT_PRECEDENCE.
     */
    public static final Set<String> DEFAULT_RIGHT_ASSOC =
        Collections.unmodifiableSet(new HashSet<String>(
            Arrays.asList("**", "and", "or")));

    /**
     * A ChainBuilder producing immutable (op, lhs, rhs) lists.
     */
    public static final ChainBuilder TRIPLE = new ChainBuilder() {
        public Object build(Object op, Object lhs, Object rhs) {
            return Collections.unmodifiableList(Arrays.asList(op, lhs, rhs));
        }
    };

    static {
        Map<String, Integer> prec = new LinkedHashMap<String, Integer>();
        String[][] levels = {
            {"or"}, {"and"}, {"not"},
            {"==", "!=", "<", "<=", ">", ">=", "is", "is not", "in",
             "not in"},
            {"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"},
            {"*", "/", "//", "%", "@"}, {"~"}, {"**"}
        };
        for (int i = 0; i < levels.length; i++) {
            for (String sym : levels[i]) prec.put(sym, i + 1);
        }
        DEFAULT_PRECEDENCE = Collections.unmodifiableMap(prec);
    }

    private Operators() {}

    /**
     * Fold an alternating value/operator chain into nested values.
     * chain must have the form [value, op, value, ..., op, value] (an odd
     * amount of elements, at least one). The operator with the highest
     * precedence is reduced first; among operators of equal precedence,
     * right-associative ones reduce from the right and left-associative
     * ones from the left. Operators missing from precedence are an error.
     */
    public static Object reduceChain(List<?> chain,
                                     Map<?, Integer> precedence,
                                     Set<?> rightAssoc,
                                     ChainBuilder builder) {
        if (chain.isEmpty() || chain.size() % 2 == 0)
            throw new IllegalArgumentException("Operator chain must have " +
                "an odd amount of elements, got " + chain.size());
        List<Object> seq = new ArrayList<Object>(chain);
        while (seq.size() > 1) {
            int best = -1, bestPrec = 0, bestOrder = 0;
            for (int i = 1; i < seq.size(); i += 2) {
                Object op = seq.get(i);
                Integer prec = precedence.get(op);
                if (prec == null)
                    throw new IllegalArgumentException("Unknown operator " +
                        op + " in chain");
                int order = (rightAssoc.contains(op)) ? i : -i;
                if (best == -1 || prec > bestPrec ||
                        (prec == bestPrec && order > bestOrder)) {
                    best = i;
                    bestPrec = prec;
                    bestOrder = order;
                }
            }
            Object node = builder.build(seq.get(best), seq.get(best - 1),
                                        seq.get(best + 1));
            seq.subList(best - 1, best + 2).clear();
            seq.add(best - 1, node);
        }
        return seq.get(0);
    }

    /**
     * Reduce a chain using the default precedence table and the
     * TRIPLE builder.
     */
    public static Object reduceChain(List<?> chain) {
        return reduceChain(chain, DEFAULT_PRECEDENCE, DEFAULT_RIGHT_ASSOC,
                           TRIPLE);
    }

    /**
     * Reduce a chain whose operators are BinaryOperator-s carrying their
     * own precedence and associativity.
     */
    public static Object reduceChain(List<?> chain, ChainBuilder builder) {
        Map<Object, Integer> precedence = new LinkedHashMap<Object, Integer>();
        Set<Object> rightAssoc = new HashSet<Object>();
        for (int i = 1; i < chain.size(); i += 2) {
            Object op = chain.get(i);
            if (! (op instanceof BinaryOperator))
                throw new IllegalArgumentException("Chain element " + i +
                    " is not a binary operator: " + op);
            BinaryOperator bop = (BinaryOperator) op;
            precedence.put(bop, bop.getPrecedence());
            if (bop.isRightAssociative()) rightAssoc.add(bop);
        }
        return reduceChain(chain, precedence, rightAssoc, builder);
    }

}
