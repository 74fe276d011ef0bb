package net.ox.target.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.PrintContext;
import net.ox.ast.Tree;
import net.ox.ast.mixins.ContainerNode;

/**
 * A dict display: "{k: v, ...}".
 * The items alternate between keys and values.
 */
public class DictExpr extends ContainerNode implements Expr {

    public static final AstType TYPE = AstType.node("DictExpr",
                                                    DictExpr.class,
                                                    PyNode.EXPR)
        .field("items", Tree.class)
        .symbol("dict", Displays.constructor(DictExpr.class))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new DictExpr((Tree) args[0]);
            }
        })
        .build();

    public DictExpr(Tree items) {
        super(TYPE, Displays.items(items, "DictExpr"));
        if (items.getChildren().size() % 2 != 0)
            throw new ConstructionException("DictExpr expects alternating " +
                "keys and values, got an odd amount of items");
    }
    public DictExpr(Expr... items) {
        this(new Tree("items", items));
    }

    /**
     * Convert a host map, coercing its keys and values into h.
     */
    public static DictExpr of(Hierarchy h, Map<?, ?> map) {
        List<Object> flat = new ArrayList<Object>(map.size() * 2);
        for (Map.Entry<?, ?> ent : map.entrySet()) {
            flat.add(ent.getKey());
            flat.add(ent.getValue());
        }
        return new DictExpr(Displays.coerceAll(h, flat));
    }

    protected Brackets getDelimiters() {
        return Brackets.of("{", "}");
    }

    protected void printItems(List<Ast> items, PrintContext ctx,
                              List<String> out) {
        for (int i = 0; i < items.size(); i += 2) {
            if (i != 0) out.add(", ");
            printChild(items.get(i), "items", ctx, out);
            out.add(": ");
            printChild(items.get(i + 1), "items", ctx, out);
        }
    }

}
