package net.ox.target.python;

import java.util.ArrayList;
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
 * A conditional statement.
 * An else branch consisting of nothing but another conditional is printed
 * as "elif".
 */
public class If extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("If", If.class,
                                                    PyNode.STMT)
        .field("cond", Expr.class)
        .field("body", Block.class)
        .field("other", Block.class)
        .symbol("if", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                return chain(h, args);
            }
            public String toString() {
                return "if constructor";
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new If((Expr) args[0], (Block) args[1],
                              (Block) args[2]);
            }
        })
        .build();

    public If(Expr cond, Block body, Block other) {
        super(TYPE, cond, body, other);
    }
    public If(Expr cond, Block body) {
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
        out.add("if ");
        printChild(getCondition(), "cond", ctx, out);
        getBody().printBlock(ctx, out);
        List<Ast> other = getOther().getStatements();
        if (other.size() == 1 && other.get(0) instanceof If) {
            out.add(ctx.startLine());
            out.add("el");
            out.addAll(other.get(0).getTokens(ctx));
        } else {
            printElse(getOther(), ctx, out);
        }
    }

    /**
     * Print the else branch of a compound statement, if it is not empty.
     */
    static void printElse(Block other, PrintContext ctx, List<String> out) {
        if (other.getStatements().isEmpty()) return;
        out.add(ctx.startLine());
        out.add("else");
        other.printBlock(ctx, out);
    }

    /* (cond body cond body ... [other]) */
    private static If chain(Hierarchy h, List<?> args) {
        if (args.size() < 2)
            throw new ConstructionException("if expects a condition and " +
                "a body, got " + args.size() + " argument(s)");
        Expr cond = h.coerce(args.get(0), Expr.class);
        Block body = Block.of(h, args.get(1));
        Block other;
        if (args.size() == 2) {
            other = new Block();
        } else if (args.size() == 3) {
            other = Block.of(h, args.get(2));
        } else {
            other = new Block(chain(h, new ArrayList<Object>(
                args.subList(2, args.size()))));
        }
        return new If(cond, body, other);
    }

}
