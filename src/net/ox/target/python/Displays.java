package net.ox.target.python;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.SExprConstructor;
import net.ox.ast.Tree;

/**
 * Helpers for the container displays (tuples, lists, sets, dicts).
 */
final class Displays {

    private Displays() {}

    static Tree items(Tree items, String type) {
        for (Ast a : items.getChildren()) {
            if (! (a instanceof Expr))
                throw new ConstructionException("Invalid item " +
                    a.getName() + " in " + type);
        }
        return items;
    }

    /**
     * An S-expression constructor building a display of type cls from
     * its (coerced) arguments.
     */
    static SExprConstructor constructor(final Class<? extends Ast> cls) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                return h.construct(cls, Collections.singletonList(
                    coerceAll(h, args)), kwargs);
            }
            public String toString() {
                return "display constructor of " + cls.getSimpleName();
            }
        };
    }

    static Tree coerceAll(Hierarchy h, Collection<?> values) {
        List<Ast> items = new ArrayList<Ast>(values.size());
        for (Object v : values) items.add(h.coerce(v, Expr.class));
        return new Tree("items", items);
    }

}
