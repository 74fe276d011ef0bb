package net.ox.operators;

/**
 * An operator of some expression language.
 * Operators are usually enumeration members; the symbol is the text the
 * operator is written as (e.g. "+" or "not in").
 */
public interface Operator {

    /**
     * The textual representation of this operator.
     */
    String getSymbol();

    /**
     * The binding strength of this operator; higher binds tighter.
     */
    int getPrecedence();

}
