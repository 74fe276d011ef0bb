package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;

public class And extends BoolOp {

    public static final AstType TYPE = declare("And", And.class,
        PyBinaryOp.AND, new AstType.Factory() {
            public Ast create(Object[] args) {
                checkOperator(args[0], PyBinaryOp.AND);
                return new And((Expr) args[1], (Expr) args[2]);
            }
        }).build();

    public And(Expr lhs, Expr rhs) {
        super(TYPE, PyBinaryOp.AND, lhs, rhs);
    }

}
