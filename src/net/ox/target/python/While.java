package net.ox.target.python;

import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;

/**
 * A loop running while its condition holds, with an optional else
 * branch.
 */
public class While extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("While", While.class,
                                                    PyNode.STMT)
        .field("cond", Expr.class)
        .field("body", Block.class)
        .field("other", Block.class)
        .symbol("while", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() != 2 && args.size() != 3)
                    throw new ConstructionException("while expects a " +
                        "condition, a body, and an optional else branch");
                return new While(h.coerce(args.get(0), Expr.class),
                    Block.of(h, args.get(1)), (args.size() == 3) ?
                    Block.of(h, args.get(2)) : new Block());
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new While((Expr) args[0], (Block) args[1],
                                 (Block) args[2]);
            }
        })
        .build();

    public While(Expr cond, Block body, Block other) {
        super(TYPE, cond, body, other);
    }
    public While(Expr cond, Block body) {
        this(cond, body, new Block());
    }

    public Expr getCondition() {
        return (Expr) getChild(0);
    }

    public Block getBody() {
        return (Block) getChild(1);
    }

    public Block getOther() {
        return (Block) getChild(2);
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add("while ");
        printChild(getCondition(), "cond", ctx, out);
        getBody().printBlock(ctx, out);
        If.printElse(getOther(), ctx, out);
    }

}
