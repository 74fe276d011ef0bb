package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.mixins.GetAttrNode;

/**
 * Attribute access.
 * Numeric literals are bracketed, since "1.foo" would read as a float.
 */
public class GetAttr extends GetAttrNode implements Expr {

    public static final AstType TYPE = AstType.node("GetAttr", GetAttr.class,
                                                    PyNode.EXPR)
        .field("attr", String.class)
        .field("expr", Expr.class)
        .symbol(".", attrConstructor(GetAttr.class))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new GetAttr((String) args[0], (Expr) args[1]);
            }
        })
        .build();

    public GetAttr(String attr, Expr expr) {
        super(TYPE, attr, expr);
        if (! Name.isIdentifier(attr))
            throw new ConstructionException("Invalid attribute name " + attr);
    }
    public GetAttr(Expr expr, String attr) {
        this(attr, expr);
    }

    protected boolean wrapsExpression(Ast child) {
        if (child instanceof Atom && ((Atom) child).getValue()
                instanceof Number)
            return true;
        return PyNode.level(child) < PyNode.LEVEL_PRIMARY;
    }

}
