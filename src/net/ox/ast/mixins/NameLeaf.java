package net.ox.ast.mixins;

import java.util.Set;
import net.ox.ast.AstType;
import net.ox.ast.Leaf;

/**
 * A leaf naming a variable.
 * The name is the only free variable of the leaf, unless a surrounding
 * construct binds it.
 */
public abstract class NameLeaf extends Leaf {

    protected NameLeaf(AstType type, String name) {
        super(type, name);
    }

    public String getValue() {
        return (String) super.getValue();
    }

    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        if (! exclude.contains(getValue())) out.add(getValue());
    }

}
