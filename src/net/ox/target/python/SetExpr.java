package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Tree;
import net.ox.ast.mixins.ContainerNode;

/**
 * A set display: "{a, b}"; the empty set prints as "set()".
 */
public class SetExpr extends ContainerNode implements Expr {

    public static final AstType TYPE = AstType.node("SetExpr", SetExpr.class,
                                                    PyNode.EXPR)
        .field("items", Tree.class)
        .symbol("set", Displays.constructor(SetExpr.class))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new SetExpr((Tree) args[0]);
            }
        })
        .build();

    public SetExpr(Tree items) {
        super(TYPE, Displays.items(items, "SetExpr"));
    }
    public SetExpr(Expr... items) {
        this(new Tree("items", items));
    }

    protected Brackets getDelimiters() {
        return Brackets.of("{", "}");
    }

    protected String emptySource() {
        return "set()";
    }

}
