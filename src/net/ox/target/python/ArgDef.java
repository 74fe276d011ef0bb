package net.ox.target.python;

import java.util.Collections;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;

/**
 * A keyword argument of a call, or a parameter with a default value:
 * "name=value".
 * Only the value contributes free variables.
 */
public class ArgDef extends Node {

    public static final AstType TYPE = AstType.node("ArgDef", ArgDef.class,
                                                    PyNode.ROOT)
        .field("name", Name.class)
        .field("value", Expr.class)
        .template("{name}={value}")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new ArgDef((Name) args[0], (Expr) args[1]);
            }
        })
        .build();

    public ArgDef(Name name, Expr value) {
        super(TYPE, name, value);
    }
    public ArgDef(String name, Expr value) {
        this(new Name(name), value);
    }

    public Name getNameNode() {
        return (Name) getChild(0);
    }

    public Expr getValue() {
        return (Expr) getChild(1);
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        out.addAll(getValue().getFreeVars(exclude,
                                          Collections.<String>emptySet()));
    }

}
