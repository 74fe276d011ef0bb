package net.ox.ast.mixins;

import java.util.List;
import net.ox.ast.AstType;
import net.ox.ast.Leaf;
import net.ox.ast.PrintContext;
import net.ox.ast.StaticValue;

/**
 * A leaf holding a literal constant.
 * Its static value is the constant itself; subclasses decide how the
 * constant is written in source form.
 */
public abstract class AtomLeaf extends Leaf {

    protected AtomLeaf(AstType type, Object value) {
        super(type, value);
    }

    public StaticValue getStaticValue() {
        return StaticValue.of(getValue());
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add(formatSource(getValue()));
    }

    /**
     * Render value as a literal of the target language.
     */
    protected abstract String formatSource(Object value);

}
