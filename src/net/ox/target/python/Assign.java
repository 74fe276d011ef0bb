package net.ox.target.python;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;

/**
 * An assignment: "lhs = rhs".
 * Names assigned to are bindings, not uses; attribute and item targets
 * use their base expressions.
 */
public class Assign extends Node implements Stmt {

    public static final AstType TYPE = AstType.node("Assign", Assign.class,
                                                    PyNode.STMT)
        .field("lhs", Expr.class)
        .field("rhs", Expr.class)
        .template("{lhs} = {rhs}")
        .symbol("=")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Assign((Expr) args[0], (Expr) args[1]);
            }
        })
        .build();

    public Assign(Expr lhs, Expr rhs) {
        super(TYPE, lhs, rhs);
    }

    public Expr getTarget() {
        return (Expr) getChild(0);
    }

    public Expr getValue() {
        return (Expr) getChild(1);
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        Set<String> none = Collections.<String>emptySet();
        if (targetNames(getTarget()) == null)
            out.addAll(getTarget().getFreeVars(exclude, none));
        out.addAll(getValue().getFreeVars(exclude, none));
    }

    /**
     * The names bound by assigning to target, or null if target is not
     * a name or a tuple or list of names.
     */
    static Set<String> targetNames(Ast target) {
        Set<String> ret = new LinkedHashSet<String>();
        if (target instanceof Name) {
            ret.add(((Name) target).getValue());
            return ret;
        }
        if (! (target instanceof Tuple || target instanceof ListExpr))
            return null;
        for (Ast item : target.getChildren().get(0).getChildren()) {
            Set<String> sub = targetNames(item);
            if (sub == null) return null;
            ret.addAll(sub);
        }
        return ret;
    }

}
