package net.ox.target.python;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.Tree;

/**
 * An anonymous function: "lambda params: body".
 * The parameters are bound in the body.
 */
public class Lambda extends Node implements Expr {

    public static final AstType TYPE = AstType.node("Lambda", Lambda.class,
                                                    PyNode.EXPR)
        .field("args", Tree.class)
        .field("body", Expr.class)
        .symbol("lambda")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Lambda((Tree) args[0], (Expr) args[1]);
            }
        })
        .build();

    public Lambda(Tree args, Expr body) {
        super(TYPE, args, body);
        Params.check(args);
    }

    public Tree getParameters() {
        return (Tree) getChild(0);
    }

    public Expr getBody() {
        return (Expr) getChild(1);
    }

    protected Set<String> getBoundNames() {
        return Params.names(getParameters());
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        Params.collectDefaults(getParameters(), exclude, out);
        Set<String> inner = new HashSet<String>(exclude);
        inner.addAll(getBoundNames());
        out.addAll(getBody().getFreeVars(inner,
                                         Collections.<String>emptySet()));
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add("lambda");
        boolean first = true;
        for (Ast p : getParameters().getChildren()) {
            out.add(first ? " " : ", ");
            printChild(p, "args", ctx, out);
            first = false;
        }
        out.add(": ");
        printChild(getBody(), "body", ctx, out);
    }

}
