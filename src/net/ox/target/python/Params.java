package net.ox.target.python;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.ConstructionException;
import net.ox.ast.Tree;

/**
 * Helpers for parameter lists (Trees of Name-s and ArgDef-s).
 */
final class Params {

    private Params() {}

    static void check(Tree params) {
        boolean defaults = false;
        for (Ast p : params.getChildren()) {
            if (p instanceof ArgDef) {
                defaults = true;
            } else if (! (p instanceof Name)) {
                throw new ConstructionException("Invalid parameter " +
                                                p.getName());
            } else if (defaults) {
                throw new ConstructionException("Parameter without " +
                    "default follows parameter with default");
            }
        }
    }

    static Set<String> names(Tree params) {
        Set<String> ret = new LinkedHashSet<String>();
        for (Ast p : params.getChildren()) {
            if (p instanceof ArgDef) {
                ret.add(((ArgDef) p).getNameNode().getValue());
            } else {
                ret.add(((Name) p).getValue());
            }
        }
        return ret;
    }

    /* Default values are evaluated in the enclosing scope. */
    static void collectDefaults(Tree params, Set<String> exclude,
                                Set<String> out) {
        for (Ast p : params.getChildren()) {
            if (p instanceof ArgDef)
                out.addAll(p.getFreeVars(exclude,
                                         Collections.<String>emptySet()));
        }
    }

}
