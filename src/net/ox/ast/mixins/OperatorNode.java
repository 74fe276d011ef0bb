package net.ox.ast.mixins;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.CoercionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Node;
import net.ox.operators.Operator;

/**
 * A node whose tag is an operator.
 */
public abstract class OperatorNode extends Node {

    protected OperatorNode(AstType type, Object... args) {
        super(type, args);
        if (! (getTag() instanceof Operator))
            throw new IllegalStateException("AST type " + type.getName() +
                " must declare an operator tag field");
    }

    public Operator getOperator() {
        return (Operator) getTag();
    }

    public int getPrecedence() {
        return getOperator().getPrecedence();
    }

    /**
     * The binding strength of child when printed inside this node.
     * Operator applications have their operator's precedence; anything
     * else binds tightest.
     */
    protected int precedenceOf(Ast child) {
        if (child instanceof OperatorNode)
            return ((OperatorNode) child).getPrecedence();
        return Integer.MAX_VALUE;
    }

    protected String formatTag() {
        return getOperator().getSymbol();
    }

    /**
     * Convert the result of a static evaluation into an AST element.
     * The default coerces value into this node's hierarchy.
     */
    protected Ast constant(Object value) {
        Hierarchy h = getType().getHierarchy();
        if (h == null)
            throw new CoercionException("AST type " + getName() +
                " is not registered in a hierarchy");
        return h.coerce(value);
    }

}
