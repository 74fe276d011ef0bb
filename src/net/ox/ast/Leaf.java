package net.ox.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * An AST element holding a single value and no children.
 * The value must be an instance of the type's value type; null is only
 * accepted by leaf types whose value type is Object.
 */
public abstract class Leaf extends AbstractAst {

    private final Object value;

    protected Leaf(AstType type, Object value) {
        super(type);
        if (! type.isLeaf())
            throw new ConstructionException("AST type " + type.getName() +
                " does not describe leaves");
        Class<?> vt = type.getValueType();
        if ((value == null) ? vt != Object.class :
                ! AstType.box(vt).isInstance(value))
            throw new ConstructionException("Invalid value for field " +
                "value of " + type.getName() + ": expected " +
                vt.getSimpleName() + ", got " + AstType.describe(value));
        this.value = value;
    }

    public String toString() {
        return getName() + "(" + formatValue(value) + ")";
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (! (other instanceof Leaf)) return false;
        Leaf l = (Leaf) other;
        if (l.getType() != getType()) return false;
        return (value == null) ? l.value == null : value.equals(l.value);
    }

    public int hashCode() {
        return getType().getName().hashCode() ^
            ((value == null) ? 0 : value.hashCode());
    }

    public Object getValue() {
        return value;
    }

    public List<Ast> getChildren() {
        return Collections.emptyList();
    }

    public Ast copy() {
        return withAttributesOf(getType().create(new Object[] {value}));
    }

    public Ast simplify() {
        return copy();
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {}

    /**
     * Print the value's string representation.
     */
    protected void printTo(PrintContext ctx, List<String> out) {
        out.add(String.valueOf(value));
    }

}
