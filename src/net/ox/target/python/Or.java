package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;

public class Or extends BoolOp {

    public static final AstType TYPE = declare("Or", Or.class,
        PyBinaryOp.OR, new AstType.Factory() {
            public Ast create(Object[] args) {
                checkOperator(args[0], PyBinaryOp.OR);
                return new Or((Expr) args[1], (Expr) args[2]);
            }
        }).build();

    public Or(Expr lhs, Expr rhs) {
        super(TYPE, PyBinaryOp.OR, lhs, rhs);
    }

}
