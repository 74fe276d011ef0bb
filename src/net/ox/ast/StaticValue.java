package net.ox.ast;

/**
 * The compile-time value of an AST subtree, if it has one.
 * Leaves of atomic types know their value; nodes know it only if all of
 * their children do and the node type can fold them. UNKNOWN marks a value
 * that cannot be determined statically; note that a known value may itself
 * be null.
 */
public final class StaticValue {

    public static final StaticValue UNKNOWN = new StaticValue(false, null);

    private final boolean known;
    private final Object value;

    private StaticValue(boolean known, Object value) {
        this.known = known;
        this.value = value;
    }

    public String toString() {
        if (! known) return "StaticValue.UNKNOWN";
        return "StaticValue.of(" + value + ")";
    }

    public boolean equals(Object other) {
        if (! (other instanceof StaticValue)) return false;
        StaticValue sv = (StaticValue) other;
        if (known != sv.known) return false;
        return (value == null) ? sv.value == null : value.equals(sv.value);
    }

    public int hashCode() {
        if (! known) return 0;
        return (value == null) ? 1 : value.hashCode();
    }

    /**
     * Whether the value is known.
     */
    public boolean isKnown() {
        return known;
    }

    /**
     * The value.
     * Throws an IllegalStateException if the value is not known.
     */
    public Object getValue() {
        if (! known)
            throw new IllegalStateException("Static value is not known");
        return value;
    }

    /**
     * A known static value.
     */
    public static StaticValue of(Object value) {
        return new StaticValue(true, value);
    }

}
