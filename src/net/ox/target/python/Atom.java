package net.ox.target.python;

import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.mixins.AtomLeaf;
import net.ox.util.Formats;

/**
 * A literal constant: an int (Long), a float (Double), a str (String), a
 * bool (Boolean), or None (null).
 * Smaller Java integer and floating-point types are widened on
 * construction.
 */
public class Atom extends AtomLeaf implements Expr {

    public static final AstType TYPE = AstType.leaf("Atom", Atom.class,
                                                    PyNode.EXPR, Object.class)
        .represents(Long.class, Integer.class, Short.class, Byte.class,
                    Double.class, Float.class, String.class, Boolean.class,
                    Void.class)
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Atom(args[0]);
            }
        })
        .build();

    public Atom(Object value) {
        super(TYPE, normalize(value));
    }

    public boolean isNone() {
        return getValue() == null;
    }

    /**
     * Whether this is a number below zero (which prints with a sign).
     */
    public boolean isNegative() {
        Object v = getValue();
        if (v instanceof Long) return (Long) v < 0;
        if (v instanceof Double)
            return (Double) v < 0 || (1 / (Double) v) < 0;
        return false;
    }

    protected String formatSource(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean)
            return ((Boolean) value) ? "True" : "False";
        if (value instanceof String)
            return Formats.formatString((String) value, '\'');
        if (value instanceof Double) return formatFloat((Double) value);
        return String.valueOf(value);
    }

    private static String formatFloat(double d) {
        if (Double.isNaN(d)) return "float('nan')";
        if (Double.isInfinite(d))
            return (d > 0) ? "float('inf')" : "-float('inf')";
        return Double.toString(d).replace('E', 'e');
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short ||
                value instanceof Byte)
            return ((Number) value).longValue();
        if (value instanceof Float) return ((Float) value).doubleValue();
        if (value == null || value instanceof Long ||
                value instanceof Double || value instanceof String ||
                value instanceof Boolean)
            return value;
        throw new ConstructionException("Invalid value for field value of " +
            "Atom: expected a number, string, boolean, or null, got " +
            value.getClass().getName());
    }

}
