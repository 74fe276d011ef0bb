package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Node;

/**
 * A conditional expression: "then if cond else other".
 */
public class Ternary extends Node implements Expr {

    public static final AstType TYPE = AstType.node("Ternary", Ternary.class,
                                                    PyNode.EXPR)
        .field("cond", Expr.class)
        .field("then", Expr.class)
        .field("other", Expr.class)
        .template("{then} if {cond} else {other}")
        .symbol("ifexp")
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Ternary((Expr) args[0], (Expr) args[1],
                                   (Expr) args[2]);
            }
        })
        .build();

    public Ternary(Expr cond, Expr then, Expr other) {
        super(TYPE, cond, then, other);
    }

    public Expr getCondition() {
        return (Expr) getChild(0);
    }

    public Expr getThen() {
        return (Expr) getChild(1);
    }

    public Expr getOther() {
        return (Expr) getChild(2);
    }

    /* The else branch may itself be a conditional (or a lambda). */
    protected Brackets wrapChild(Ast child, String role) {
        if ("other".equals(role)) return Brackets.NONE;
        return (PyNode.level(child) <= PyNode.LEVEL_TERNARY) ?
            Brackets.PARENS : Brackets.NONE;
    }

    protected Ast fromStaticChildren(Object... values) {
        return withAttributesOf(new Atom(PyValues.truthy(values[0]) ?
                                         values[1] : values[2]));
    }

}
