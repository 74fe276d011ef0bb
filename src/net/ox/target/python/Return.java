package net.ox.target.python;

import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.SExprConstructor;
import net.ox.ast.mixins.CommandNode;

/**
 * "return expr"; returning None prints as a bare "return".
 */
public class Return extends CommandNode implements Stmt {

    public static final AstType TYPE = AstType.node("Return", Return.class,
                                                    PyNode.STMT)
        .field("expr", Expr.class)
        .template("return {expr}")
        .symbol("return", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() > 1)
                    throw new ConstructionException("return expects at " +
                        "most one value, got " + args.size());
                return new Return(args.isEmpty() ? new Atom(null) :
                                  h.coerce(args.get(0), Expr.class));
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Return((Expr) args[0]);
            }
        })
        .build();

    public Return(Expr expr) {
        super(TYPE, "return", expr);
    }
    public Return() {
        this(new Atom(null));
    }

    protected boolean isEmptyExpression(Ast expr) {
        return expr instanceof Atom && ((Atom) expr).isNone();
    }

}
