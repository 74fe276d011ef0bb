package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.mixins.BinaryOpNode;

/**
 * An arithmetic, bitwise, or comparison operator application.
 * "and" and "or" have node types of their own (And and Or).
 */
public class BinOp extends BinaryOpNode implements Expr {

    public static final AstType TYPE = declareOperators(
            AstType.node("BinOp", BinOp.class, PyNode.EXPR)
                .field("op", PyBinaryOp.class)
                .field("lhs", Expr.class)
                .field("rhs", Expr.class)
                .factory(new AstType.Factory() {
                    public Ast create(Object[] args) {
                        return new BinOp((PyBinaryOp) args[0],
                                         (Expr) args[1], (Expr) args[2]);
                    }
                }),
            BinOp.class, PyBinaryOp.arithmetic(), UnaryOp.class,
            PyUnaryOp.values())
        .build();

    public BinOp(PyBinaryOp op, Expr lhs, Expr rhs) {
        super(TYPE, op, lhs, rhs);
        if (op.isBoolean())
            throw new ConstructionException("Invalid value for field op " +
                "of BinOp: " + op + " has a node type of its own");
    }

    public PyBinaryOp getOperator() {
        return (PyBinaryOp) getTag();
    }

    protected int precedenceOf(Ast child) {
        return PyNode.level(child);
    }

    /* Nested comparisons would read as a comparison chain. */
    protected Brackets wrapChild(Ast child, String role) {
        if (getOperator().isComparison() &&
                precedenceOf(child) == getPrecedence())
            return Brackets.PARENS;
        return super.wrapChild(child, role);
    }

    protected Ast constant(Object value) {
        return new Atom(value);
    }

}
