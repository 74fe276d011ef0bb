package net.ox.operators;

/**
 * An infix operator combining two operands.
 */
public interface BinaryOperator extends Operator {

    /**
     * Whether chains of this operator group to the right (a op (b op c)).
     */
    boolean isRightAssociative();

    /**
     * Whether (a op b) op c and a op (b op c) denote the same value, so
     * that a chain of this operator may be printed without brackets.
     */
    boolean isAssociative();

    /**
     * Whether apply() can evaluate this operator on the given operand
     * values.
     */
    boolean canApply(Object lhs, Object rhs);

    /**
     * Evaluate this operator on the given operand values.
     * Only valid if canApply() returns true for them.
     */
    Object apply(Object lhs, Object rhs);

}
