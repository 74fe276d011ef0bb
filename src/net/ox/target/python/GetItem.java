package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Node;

/**
 * Subscription: expr[index].
 */
public class GetItem extends Node implements Expr {

    public static final AstType TYPE = AstType.node("GetItem", GetItem.class,
                                                    PyNode.EXPR)
        .field("expr", Expr.class)
        .field("index", Expr.class)
        .template("{expr}[{index}]")
        .symbol("[]")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new GetItem((Expr) args[0], (Expr) args[1]);
            }
        })
        .build();

    public GetItem(Expr expr, Expr index) {
        super(TYPE, expr, index);
    }

    public Expr getExpression() {
        return (Expr) getChild(0);
    }

    public Expr getIndex() {
        return (Expr) getChild(1);
    }

    protected Brackets wrapChild(Ast child, String role) {
        if ("expr".equals(role) &&
                PyNode.level(child) < PyNode.LEVEL_PRIMARY)
            return Brackets.PARENS;
        return Brackets.NONE;
    }

}
