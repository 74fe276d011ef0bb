package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.mixins.BinaryOpNode;

/**
 * Common base of the short-circuiting And and Or.
 * Folding follows the operand-returning semantics of the target: "x and
 * y" is x if x is false, and y otherwise.
 */
public abstract class BoolOp extends BinaryOpNode implements Expr {

    protected BoolOp(AstType type, PyBinaryOp op, Expr lhs, Expr rhs) {
        super(type, op, lhs, rhs);
    }

    public PyBinaryOp getOperator() {
        return (PyBinaryOp) getTag();
    }

    protected int precedenceOf(Ast child) {
        return PyNode.level(child);
    }

    protected Ast constant(Object value) {
        return new Atom(value);
    }

    /**
     * Start the descriptor of a boolean operator type: fields
     * (op, lhs, rhs) and constructors under op and its symbol.
     */
    static AstType.Builder declare(String name, Class<? extends BoolOp> cls,
                                   PyBinaryOp op, AstType.Factory factory) {
        return declareOperators(AstType.node(name, cls, PyNode.EXPR)
                .field("op", PyBinaryOp.class)
                .field("lhs", Expr.class)
                .field("rhs", Expr.class)
                .factory(factory),
            cls, new PyBinaryOp[] {op}, null, null);
    }

    static void checkOperator(Object actual, PyBinaryOp expected) {
        if (actual != expected)
            throw new ConstructionException("Invalid value for field op " +
                "of " + expected.getSymbol() + " node: " + actual);
    }

}
