package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Tree;
import net.ox.ast.mixins.ContainerNode;

/**
 * A tuple display: "(a, b)"; a single item is followed by a comma.
 */
public class Tuple extends ContainerNode implements Expr {

    public static final AstType TYPE = AstType.node("Tuple", Tuple.class,
                                                    PyNode.EXPR)
        .field("items", Tree.class)
        .symbol("tuple", Displays.constructor(Tuple.class))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Tuple((Tree) args[0]);
            }
        })
        .build();

    public Tuple(Tree items) {
        super(TYPE, Displays.items(items, "Tuple"));
    }
    public Tuple(Expr... items) {
        this(new Tree("items", items));
    }

    protected Brackets getDelimiters() {
        return Brackets.PARENS;
    }

    protected boolean needsTrailingSeparator() {
        return true;
    }

}
