package net.ox.target.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;
import net.ox.ast.Tree;

/**
 * A function call: expr(arg, ..., name=value, ...).
 * The arguments are a Tree of expressions followed by ArgDef-s.
 */
public class Call extends Node implements Expr {

    /**
     * Builds a call from (function, positional arguments...) and keyword
     * arguments; all values are coerced.
     */
    public static final SExprConstructor CONSTRUCTOR =
        new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.isEmpty())
                    throw new ConstructionException(
                        "Call expects at least a function");
                List<Expr> positional = new ArrayList<Expr>();
                for (Object a : args.subList(1, args.size())) {
                    positional.add(h.coerce(a, Expr.class));
                }
                List<ArgDef> named = new ArrayList<ArgDef>();
                for (Map.Entry<String, ?> ent : kwargs.entrySet()) {
                    named.add(new ArgDef(ent.getKey(),
                        h.coerce(ent.getValue(), Expr.class)));
                }
                return new Call(h.coerce(args.get(0), Expr.class),
                                positional, named);
            }
            public String toString() {
                return "call constructor";
            }
        };

    public static final AstType TYPE = AstType.node("Call", Call.class,
                                                    PyNode.EXPR)
        .field("expr", Expr.class)
        .field("args", Tree.class)
        .symbol("call", CONSTRUCTOR)
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Call((Expr) args[0], (Tree) args[1]);
            }
        })
        .build();

    public Call(Expr expr, Tree args) {
        super(TYPE, expr, args);
        boolean keywords = false;
        for (Ast a : args.getChildren()) {
            if (a instanceof ArgDef) {
                keywords = true;
            } else if (! (a instanceof Expr)) {
                throw new ConstructionException("Invalid call argument " +
                    a.getName());
            } else if (keywords) {
                throw new ConstructionException("Positional argument " +
                    "follows keyword argument in call");
            }
        }
    }
    public Call(Expr expr, List<? extends Expr> positional,
                List<ArgDef> named) {
        this(expr, argumentTree(positional, named));
    }
    public Call(Expr expr, Expr... positional) {
        this(expr, new Tree("args", positional));
    }

    public Expr getFunction() {
        return (Expr) getChild(0);
    }

    public List<Ast> getArguments() {
        return getChild(1).getChildren();
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        printChild(getFunction(), "expr", ctx, out);
        out.add("(");
        boolean first = true;
        for (Ast a : getArguments()) {
            if (! first) out.add(", ");
            printChild(a, "args", ctx, out);
            first = false;
        }
        out.add(")");
    }

    protected Brackets wrapChild(Ast child, String role) {
        if ("expr".equals(role) &&
                PyNode.level(child) < PyNode.LEVEL_PRIMARY)
            return Brackets.PARENS;
        return Brackets.NONE;
    }

    private static Tree argumentTree(List<? extends Expr> positional,
                                     List<ArgDef> named) {
        List<Ast> items = new ArrayList<Ast>(positional);
        items.addAll(named);
        return new Tree("args", items);
    }

}
