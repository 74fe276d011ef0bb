package net.ox.operators;

/**
 * Callback combining an operator and its two operands into a value during
 * chain reduction.
 */
public interface ChainBuilder {

    /**
     * Combine lhs and rhs using op.
     */
    Object build(Object op, Object lhs, Object rhs);

}
