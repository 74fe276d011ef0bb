package net.ox.target.python;

import java.util.Arrays;
import java.util.HashSet;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.mixins.UnaryOpNode;

/**
 * A prefix operator application ("not x", "-x", "+x", "~x").
 * The sign symbols are registered by BinOp, which dispatches on the
 * number of operands.
 */
public class UnaryOp extends UnaryOpNode implements Expr {

    public static final AstType TYPE = declareOperators(
            AstType.node("UnaryOp", UnaryOp.class, PyNode.EXPR)
                .field("op", PyUnaryOp.class)
                .field("expr", Expr.class)
                .factory(new AstType.Factory() {
                    public Ast create(Object[] args) {
                        return new UnaryOp((PyUnaryOp) args[0],
                                           (Expr) args[1]);
                    }
                }),
            UnaryOp.class, PyUnaryOp.values(),
            new HashSet<String>(Arrays.asList("+", "-")))
        .build();

    public UnaryOp(PyUnaryOp op, Expr expr) {
        super(TYPE, op, expr);
    }

    public PyUnaryOp getOperator() {
        return (PyUnaryOp) getTag();
    }

    protected int precedenceOf(Ast child) {
        return PyNode.level(child);
    }

    protected Ast constant(Object value) {
        return new Atom(value);
    }

}
