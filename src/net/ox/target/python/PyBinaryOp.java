package net.ox.target.python;

import java.util.HashMap;
import java.util.Map;
import net.ox.operators.BinaryOperator;
import net.ox.operators.Operators;

/**
 * The infix operators of the Python-like target.
 * Precedences and associativity follow Operators.DEFAULT_PRECEDENCE and
 * Operators.DEFAULT_RIGHT_ASSOC.
 */
public enum PyBinaryOp implements BinaryOperator {

    OR("or"),
    AND("and"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IS("is"),
    IS_NOT("is not"),
    IN("in"),
    NOT_IN("not in"),
    BIT_OR("|"),
    XOR("^"),
    BIT_AND("&"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    MATMUL("@"),
    POW("**");

    private static final Map<String, PyBinaryOp> BY_SYMBOL;

    static {
        BY_SYMBOL = new HashMap<String, PyBinaryOp>();
        for (PyBinaryOp op : values()) BY_SYMBOL.put(op.symbol, op);
    }

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;

    private PyBinaryOp(String symbol) {
        this.symbol = symbol;
        this.precedence = Operators.DEFAULT_PRECEDENCE.get(symbol);
        this.rightAssociative = Operators.DEFAULT_RIGHT_ASSOC.contains(
            symbol);
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public boolean isAssociative() {
        switch (this) {
            case OR: case AND: case BIT_OR: case XOR: case BIT_AND:
            case ADD: case MUL:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether this is one of the short-circuiting "and" and "or".
     */
    public boolean isBoolean() {
        return this == AND || this == OR;
    }

    /**
     * Whether this is a comparison (which chains instead of nesting).
     */
    public boolean isComparison() {
        return precedence == EQ.precedence;
    }

    public boolean canApply(Object lhs, Object rhs) {
        return PyValues.evaluate(this, lhs, rhs) != PyValues.NO_VALUE;
    }

    public Object apply(Object lhs, Object rhs) {
        Object ret = PyValues.evaluate(this, lhs, rhs);
        if (ret == PyValues.NO_VALUE)
            throw new IllegalArgumentException("Cannot evaluate " + symbol +
                " on " + lhs + " and " + rhs);
        return ret;
    }

    /**
     * The operator written as symbol, or null.
     * Runs of whitespace in symbol are treated as single spaces.
     */
    public static PyBinaryOp fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol.trim().replaceAll("\\s+", " "));
    }

    /**
     * All operators except "and" and "or".
     */
    public static PyBinaryOp[] arithmetic() {
        PyBinaryOp[] all = values();
        PyBinaryOp[] ret = new PyBinaryOp[all.length - 2];
        int i = 0;
        for (PyBinaryOp op : all) {
            if (! op.isBoolean()) ret[i++] = op;
        }
        return ret;
    }

}
