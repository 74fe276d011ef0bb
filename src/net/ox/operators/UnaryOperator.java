package net.ox.operators;

/**
 * A prefix operator applied to a single operand.
 */
public interface UnaryOperator extends Operator {

    /**
     * Whether apply() can evaluate this operator on the given value.
     */
    boolean canApply(Object operand);

    /**
     * Evaluate this operator on the given value.
     * Only valid if canApply() returns true for it.
     */
    Object apply(Object operand);

}
