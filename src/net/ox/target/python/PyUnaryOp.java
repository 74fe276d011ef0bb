package net.ox.target.python;

import java.util.HashMap;
import java.util.Map;
import net.ox.operators.Operators;
import net.ox.operators.UnaryOperator;

/**
 * The prefix operators of the Python-like target.
 * The sign operators bind like "~".
 */
public enum PyUnaryOp implements UnaryOperator {

    NOT("not", Operators.DEFAULT_PRECEDENCE.get("not")),
    POS("+", Operators.DEFAULT_PRECEDENCE.get("~")),
    NEG("-", Operators.DEFAULT_PRECEDENCE.get("~")),
    INVERT("~", Operators.DEFAULT_PRECEDENCE.get("~"));

    private static final Map<String, PyUnaryOp> BY_SYMBOL;

    static {
        BY_SYMBOL = new HashMap<String, PyUnaryOp>();
        for (PyUnaryOp op : values()) BY_SYMBOL.put(op.symbol, op);
    }

    private final String symbol;
    private final int precedence;

    private PyUnaryOp(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean canApply(Object operand) {
        return PyValues.evaluate(this, operand) != PyValues.NO_VALUE;
    }

    public Object apply(Object operand) {
        Object ret = PyValues.evaluate(this, operand);
        if (ret == PyValues.NO_VALUE)
            throw new IllegalArgumentException("Cannot evaluate " + symbol +
                " on " + operand);
        return ret;
    }

    public static PyUnaryOp fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol.trim());
    }

}
