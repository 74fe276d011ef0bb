package net.ox.target.python;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;
import net.ox.ast.Tree;

/**
 * A function definition.
 * The function forms a scope: its parameters, its own name, and every
 * name assigned to in its body (outside of nested functions and lambdas)
 * are local to it. Default values belong to the enclosing scope.
 */
public class Function extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("Function",
                                                    Function.class,
                                                    PyNode.STMT)
        .field("name", Name.class)
        .field("args", Tree.class)
        .field("body", Block.class)
        .symbol("def", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                return define(h, args, kwargs);
            }
            public String toString() {
                return "def constructor";
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Function((Name) args[0], (Tree) args[1],
                                    (Block) args[2]);
            }
        })
        .build();

    public Function(Name name, Tree args, Block body) {
        super(TYPE, name, args, body);
        Params.check(args);
    }

    public Name getNameNode() {
        return (Name) getChild(0);
    }

    public String getFunctionName() {
        return getNameNode().getValue();
    }

    public Tree getParameters() {
        return (Tree) getChild(1);
    }

    public Block getBody() {
        return (Block) getChild(2);
    }

    protected Set<String> getBoundNames() {
        Set<String> ret = new LinkedHashSet<String>(
            Params.names(getParameters()));
        ret.add(getFunctionName());
        collectLocals(getBody(), ret);
        return ret;
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        Params.collectDefaults(getParameters(), exclude, out);
        Set<String> inner = new HashSet<String>(exclude);
        inner.addAll(getBoundNames());
        out.addAll(getBody().getFreeVars(inner,
                                         Collections.<String>emptySet()));
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add("def ");
        printChild(getNameNode(), "name", ctx, out);
        out.add("(");
        boolean first = true;
        for (Ast p : getParameters().getChildren()) {
            if (! first) out.add(", ");
            printChild(p, "args", ctx, out);
            first = false;
        }
        out.add(")");
        getBody().printBlock(ctx, out);
    }

    private static void collectLocals(Ast node, Set<String> out) {
        for (Ast child : node.getChildren()) {
            Set<String> names = null;
            if (child instanceof Assign) {
                names = Assign.targetNames(((Assign) child).getTarget());
            } else if (child instanceof For) {
                names = Assign.targetNames(((For) child).getTarget());
            } else if (child instanceof Function) {
                out.add(((Function) child).getFunctionName());
                continue;
            }
            if (names != null) out.addAll(names);
            if (! (child instanceof Expr)) collectLocals(child, out);
        }
    }

    /* (def name [params...] body...), keyword arguments adding
     * parameters with defaults. */
    private static Function define(Hierarchy h, List<?> args,
                                   Map<String, ?> kwargs) {
        if (args.size() < 2)
            throw new ConstructionException("def expects a name, a " +
                "parameter list, and a body");
        Object name = args.get(0);
        Name nameNode = (name instanceof String) ? new Name((String) name) :
            h.coerce(name, Name.class);
        if (! (args.get(1) instanceof List<?>))
            throw new ConstructionException("def expects a list of " +
                "parameters, got " + args.get(1));
        List<Ast> params = new ArrayList<Ast>();
        for (Object p : (List<?>) args.get(1)) {
            params.add((p instanceof String) ? new Name((String) p) :
                       h.coerce(p));
        }
        for (Map.Entry<String, ?> ent : kwargs.entrySet()) {
            params.add(new ArgDef(ent.getKey(),
                                  h.coerce(ent.getValue(), Expr.class)));
        }
        return new Function(nameNode, new Tree("args", params),
                            Block.of(h, args.subList(2, args.size())));
    }

}
