package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Tree;
import net.ox.ast.mixins.ContainerNode;

/**
 * A list display: "[a, b]".
 */
public class ListExpr extends ContainerNode implements Expr {

    public static final AstType TYPE = AstType.node("ListExpr", ListExpr.class,
                                                    PyNode.EXPR)
        .field("items", Tree.class)
        .symbol("list", Displays.constructor(ListExpr.class))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new ListExpr((Tree) args[0]);
            }
        })
        .build();

    public ListExpr(Tree items) {
        super(TYPE, Displays.items(items, "ListExpr"));
    }
    public ListExpr(Expr... items) {
        this(new Tree("items", items));
    }

    protected Brackets getDelimiters() {
        return Brackets.SQUARE;
    }

}
