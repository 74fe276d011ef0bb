package net.ox.target.python;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.parser.ParsingException;
import net.ox.ast.Ast;
import net.ox.ast.Hierarchy;
import net.ox.ast.SExprConstructor;
import net.ox.ast.Wrapper;

/**
 * Entry point of the Python-like target: the hierarchy of its AST types
 * and S-expression helpers.
 * <p>
 * The symbol table maps operator symbols ("+", "and", "not", ...) and
 * statement keywords ("def", "return", "if", "while", "for", "=",
 * "pass", "break", "continue") to their constructors; "do" builds a
 * block, "ifexp" a conditional expression, "lambda" an anonymous
 * function, "call", "." and "[]" calls, attribute accesses and
 * subscriptions, and "tuple", "list", "set" and "dict" the displays.
 * Host values are coerced as follows: numbers, strings, booleans and null
 * become Atom-s, Lists become list displays, Sets set displays, and Maps
 * dict displays.
 */
public final class Py {

    public static final Hierarchy HIERARCHY = Hierarchy.builder(PyNode.ROOT)
        .add(PyNode.EXPR, PyNode.STMT)
        .add(Name.TYPE, Atom.TYPE, BinOp.TYPE, UnaryOp.TYPE, And.TYPE,
             Or.TYPE, Ternary.TYPE, GetAttr.TYPE, GetItem.TYPE, Call.TYPE,
             ArgDef.TYPE, Lambda.TYPE, Tuple.TYPE, ListExpr.TYPE,
             SetExpr.TYPE, DictExpr.TYPE)
        .add(ExprStmt.TYPE, Assign.TYPE, Return.TYPE, Cmd.TYPE, Block.TYPE,
             If.TYPE, While.TYPE, For.TYPE, Function.TYPE)
        .role(Hierarchy.Role.GETATTR, ".")
        .role(Hierarchy.Role.GETITEM, "[]")
        .role(Hierarchy.Role.FCALL, "call")
        .coercion(List.class, new Hierarchy.Coercion() {
            public Ast coerce(Object value) {
                return new ListExpr(Displays.coerceAll(Py.HIERARCHY,
                                                       (List<?>) value));
            }
        })
        .coercion(Set.class, new Hierarchy.Coercion() {
            public Ast coerce(Object value) {
                return new SetExpr(Displays.coerceAll(Py.HIERARCHY,
                                                      (Set<?>) value));
            }
        })
        .coercion(Map.class, new Hierarchy.Coercion() {
            public Ast coerce(Object value) {
                return DictExpr.of(Py.HIERARCHY, (Map<?, ?>) value);
            }
        })
        .build();

    private Py() {}

    /**
     * Build an element from an S-expression.
     * A head with a registered constructor (or a constructor itself) is
     * applied to the arguments; any other head without arguments is
     * coerced (so that S(1) is the literal 1).
     */
    public static Ast S(Object head, Object... args) {
        return S(head, Arrays.asList(args),
                 Collections.<String, Object>emptyMap());
    }
    public static Ast S(Object head, List<?> args, Map<String, ?> kwargs) {
        if (head != null && (HIERARCHY.getConstructor(head) != null ||
                             head instanceof SExprConstructor))
            return HIERARCHY.construct(head, args, kwargs);
        if (args.isEmpty() && kwargs.isEmpty())
            return HIERARCHY.coerce(head);
        return HIERARCHY.construct(head, args, kwargs);
    }

    public static Expr toExpr(Object value) {
        return HIERARCHY.coerce(value, Expr.class);
    }

    /**
     * Convert value into a statement; expressions become expression
     * statements.
     */
    public static Stmt toStmt(Object value) {
        return Block.statement(HIERARCHY, value);
    }

    public static Block toBlock(Object value) {
        return Block.of(HIERARCHY, value);
    }

    /**
     * Wrap value (after coercing it into an expression).
     */
    public static PyWrapper py(Object value) {
        return new PyWrapper(toExpr(value));
    }

    /**
     * Wrap a reference to the named variable.
     */
    public static PyWrapper name(String name) {
        return new PyWrapper(new Name(name));
    }

    /**
     * Parse an expression and wrap it.
     */
    public static PyWrapper parse(String source) throws ParsingException {
        return new PyWrapper(PyGrammar.parse(source));
    }

    /**
     * The element held by value if it is a wrapper, or value itself.
     */
    public static Object unwrap(Object value) {
        if (value instanceof Wrapper) return ((Wrapper) value).unwrap();
        return value;
    }

}
