package net.ox.ast.mixins;

import java.util.Arrays;
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

/**
 * Attribute access: expr.attr.
 * The attribute name is the node's tag, so it takes part in equality;
 * the node type declares it as its first field, followed by expr.
 */
public abstract class GetAttrNode extends Node {

    protected GetAttrNode(AstType type, String attr, Ast expr) {
        super(type, attr, expr);
    }

    public String getAttr() {
        return (String) getTag();
    }

    public Ast getExpression() {
        return getChild(0);
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        printChild(getExpression(), "expr", ctx, out);
        out.add(".");
        out.add(getAttr());
    }

    protected Brackets wrapChild(Ast child, String role) {
        return wrapsExpression(child) ? Brackets.PARENS : Brackets.NONE;
    }

    /**
     * Whether the accessed expression needs parentheses.
     */
    protected boolean wrapsExpression(Ast child) {
        return ! (child instanceof NameLeaf || child instanceof GetAttrNode);
    }

    /**
     * An S-expression constructor taking (expr, name), as the expression
     * wrapper passes them.
     */
    public static SExprConstructor attrConstructor(
            final Class<? extends Ast> cls) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() != 2 || ! (args.get(1) instanceof String))
                    throw new ConstructionException("Attribute access " +
                        "expects an expression and a name, got " + args);
                return h.construct(cls, Arrays.asList(args.get(1),
                    h.coerce(args.get(0))), kwargs);
            }
            public String toString() {
                return "attribute constructor of " + cls.getSimpleName();
            }
        };
    }

}
