package net.ox.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A builder-style handle around an AST element.
 * Every operation creates a new Wrapper holding a new element built via
 * the hierarchy's symbol table, with copies of the operands; the wrapped
 * element itself is never modified or attached anywhere. Operands that
 * are not AST elements are coerced into the hierarchy.
 * E.g., with a hierarchy that registers the usual operator symbols,
 * wrap(1).add(1).add(1) holds the expression 1 + 1 + 1.
 */
public class Wrapper {

    private final Hierarchy hierarchy;
    private final Ast value;
    private final String prefix;

    public Wrapper(Hierarchy hierarchy, Ast value, String prefix) {
        this.hierarchy = hierarchy;
        this.value = value;
        this.prefix = prefix;
    }
    public Wrapper(Hierarchy hierarchy, Ast value) {
        this(hierarchy, value, "wrap");
    }

    /**
     * The wrapped element's source in a prefix['...'] frame.
     */
    public String toString() {
        return prefix + "['" + value.getSource() + "']";
    }

    public boolean equals(Object other) {
        if (! (other instanceof Wrapper)) return false;
        Wrapper w = (Wrapper) other;
        return hierarchy == w.hierarchy && value.equals(w.value);
    }

    public int hashCode() {
        return value.hashCode();
    }

    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    /**
     * A (parentless) copy of the wrapped element.
     */
    public Ast unwrap() {
        return value.copy();
    }

    protected Wrapper wrap(Ast node) {
        return new Wrapper(hierarchy, node, prefix);
    }

    private Object operand(Object other) {
        if (other instanceof Wrapper) return ((Wrapper) other).unwrap();
        if (other instanceof Ast) return ((Ast) other).copy();
        return hierarchy.coerce(other);
    }

    /**
     * Apply the binary operator registered under head to this and other.
     */
    public Wrapper binary(Object head, Object other) {
        return wrap(hierarchy.construct(head, unwrap(), operand(other)));
    }

    /**
     * Apply the binary operator registered under head to other and this.
     */
    public Wrapper rbinary(Object head, Object other) {
        return wrap(hierarchy.construct(head, operand(other), unwrap()));
    }

    /**
     * Apply the unary operator registered under head to this.
     */
    public Wrapper unary(Object head) {
        return wrap(hierarchy.construct(head, unwrap()));
    }

    public Wrapper add(Object other) {
        return binary("+", other);
    }

    public Wrapper sub(Object other) {
        return binary("-", other);
    }

    public Wrapper mul(Object other) {
        return binary("*", other);
    }

    public Wrapper div(Object other) {
        return binary("/", other);
    }

    public Wrapper floorDiv(Object other) {
        return binary("//", other);
    }

    public Wrapper mod(Object other) {
        return binary("%", other);
    }

    public Wrapper pow(Object other) {
        return binary("**", other);
    }

    public Wrapper eq(Object other) {
        return binary("==", other);
    }

    public Wrapper ne(Object other) {
        return binary("!=", other);
    }

    public Wrapper lt(Object other) {
        return binary("<", other);
    }

    public Wrapper le(Object other) {
        return binary("<=", other);
    }

    public Wrapper gt(Object other) {
        return binary(">", other);
    }

    public Wrapper ge(Object other) {
        return binary(">=", other);
    }

    public Wrapper neg() {
        return unary("-");
    }

    public Wrapper pos() {
        return unary("+");
    }

    public Wrapper invert() {
        return unary("~");
    }

    /**
     * Attribute access.
     */
    public Wrapper attr(String name) {
        return wrap(hierarchy.constructRole(Hierarchy.Role.GETATTR,
            Arrays.asList(unwrap(), name),
            Collections.<String, Object>emptyMap()));
    }

    /**
     * Subscription.
     */
    public Wrapper item(Object key) {
        return wrap(hierarchy.constructRole(Hierarchy.Role.GETITEM,
            Arrays.asList(unwrap(), operand(key)),
            Collections.<String, Object>emptyMap()));
    }

    /**
     * Call with positional arguments.
     */
    public Wrapper call(Object... args) {
        return call(Arrays.asList(args),
                    Collections.<String, Object>emptyMap());
    }

    /**
     * Call with positional and keyword arguments.
     */
    public Wrapper call(List<?> args, Map<String, ?> kwargs) {
        List<Object> full = new ArrayList<Object>(args.size() + 1);
        full.add(unwrap());
        for (Object a : args) full.add(operand(a));
        return wrap(hierarchy.constructRole(Hierarchy.Role.FCALL, full,
                                            kwargs));
    }

}
