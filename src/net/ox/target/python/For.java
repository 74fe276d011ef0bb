package net.ox.target.python;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;

/**
 * "for target in iter", with an optional else branch.
 * The target names are bound in the body and the else branch; the
 * iterable is evaluated outside of them.
 */
public class For extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("For", For.class,
                                                    PyNode.STMT)
        .field("target", Expr.class)
        .field("iter", Expr.class)
        .field("body", Block.class)
        .field("other", Block.class)
        .symbol("for", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() != 3 && args.size() != 4)
                    throw new ConstructionException("for expects a " +
                        "target, an iterable, a body, and an optional " +
                        "else branch");
                Object target = args.get(0);
                return new For((target instanceof String) ?
                    new Name((String) target) :
                    h.coerce(target, Expr.class),
                    h.coerce(args.get(1), Expr.class),
                    Block.of(h, args.get(2)), (args.size() == 4) ?
                    Block.of(h, args.get(3)) : new Block());
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new For((Expr) args[0], (Expr) args[1],
                               (Block) args[2], (Block) args[3]);
            }
        })
        .build();

    public For(Expr target, Expr iter, Block body, Block other) {
        super(TYPE, target, iter, body, other);
        if (Assign.targetNames(target) == null)
            throw new ConstructionException("Invalid loop target " +
                                            target.getSource());
    }
    public For(Expr target, Expr iter, Block body) {
        this(target, iter, body, new Block());
    }

    public Expr getTarget() {
        return (Expr) getChild(0);
    }

    public Expr getIterable() {
        return (Expr) getChild(1);
    }

    public Block getBody() {
        return (Block) getChild(2);
    }

    public Block getOther() {
        return (Block) getChild(3);
    }

    protected Set<String> getBoundNames() {
        return Assign.targetNames(getTarget());
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        Set<String> none = Collections.<String>emptySet();
        out.addAll(getIterable().getFreeVars(exclude, none));
        Set<String> inner = new HashSet<String>(exclude);
        inner.addAll(getBoundNames());
        out.addAll(getBody().getFreeVars(inner, none));
        out.addAll(getOther().getFreeVars(inner, none));
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add("for ");
        printChild(getTarget(), "target", ctx, out);
        out.add(" in ");
        printChild(getIterable(), "iter", ctx, out);
        getBody().printBlock(ctx, out);
        If.printElse(getOther(), ctx, out);
    }

    protected Brackets wrapChild(Ast child, String role) {
        if ("iter".equals(role) && PyNode.level(child) < PyNode.LEVEL_TERNARY)
            return Brackets.PARENS;
        return Brackets.NONE;
    }

}
