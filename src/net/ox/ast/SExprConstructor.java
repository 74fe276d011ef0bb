package net.ox.ast;

import java.util.List;
import java.util.Map;

/**
 * A constructor invoked for an S-expression head.
 * Hierarchies map heads (strings, enumeration members, AST types, Java
 * classes) to constructors; a constructor that is used as a head itself is
 * invoked directly even if it is not registered.
 */
public interface SExprConstructor {

    /**
     * Build an element of hierarchy from positional and keyword arguments.
     * Neither collection is ever null.
     */
    Ast construct(Hierarchy hierarchy, List<?> args, Map<String, ?> kwargs);

}
