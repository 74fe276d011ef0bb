package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;

/**
 * An expression evaluated for its side effects.
 */
public class ExprStmt extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("ExprStmt",
                                                    ExprStmt.class,
                                                    PyNode.STMT)
        .field("expr", Expr.class)
        .template("{expr}")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new ExprStmt((Expr) args[0]);
            }
        })
        .build();

    public ExprStmt(Expr expr) {
        super(TYPE, expr);
    }

    public Expr getExpression() {
        return (Expr) getChild(0);
    }

}
