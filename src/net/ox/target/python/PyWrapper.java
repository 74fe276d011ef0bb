package net.ox.target.python;

import java.util.Arrays;
import java.util.Collections;
import net.ox.ast.Ast;
import net.ox.ast.Wrapper;

/**
 * A wrapper around Python-like expressions.
 * Besides the operators of Wrapper, this provides the boolean operators,
 * containment tests, and conditional expressions.
 */
public class PyWrapper extends Wrapper {

    public PyWrapper(Ast value) {
        super(Py.HIERARCHY, value, "py");
    }

    protected Wrapper wrap(Ast node) {
        return new PyWrapper(node);
    }

    public Expr getExpression() {
        return (Expr) unwrap();
    }

    public Wrapper and(Object other) {
        return binary(PyBinaryOp.AND, other);
    }

    public Wrapper or(Object other) {
        return binary(PyBinaryOp.OR, other);
    }

    public Wrapper not() {
        return unary(PyUnaryOp.NOT);
    }

    /**
     * "other in this".
     */
    public Wrapper contains(Object other) {
        return rbinary(PyBinaryOp.IN, other);
    }

    /**
     * "this if cond else other".
     */
    public Wrapper ifElse(Object cond, Object other) {
        return wrap(getHierarchy().construct("ifexp", Arrays.asList(
            Py.toExpr(Py.unwrap(cond)), unwrap(),
            Py.toExpr(Py.unwrap(other))),
            Collections.<String, Object>emptyMap()));
    }

}
