package net.ox.ast.mixins;

import java.util.List;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.Tree;

/**
 * A bracketed, comma-separated collection of expressions.
 * The items are held in a single Tree child named "items".
 */
public abstract class ContainerNode extends Node {

    protected ContainerNode(AstType type, Tree items) {
        super(type, items);
    }

    public Tree getItemTree() {
        return (Tree) getChild(0);
    }

    public List<Ast> getItems() {
        return getItemTree().getChildren();
    }

    /**
     * The brackets enclosing the items.
     */
    protected abstract Brackets getDelimiters();

    /**
     * What an empty container prints as.
     */
    protected String emptySource() {
        Brackets br = getDelimiters();
        return br.getOpen() + br.getClose();
    }

    /**
     * Whether a lone item is followed by a separator, as in "(1,)".
     */
    protected boolean needsTrailingSeparator() {
        return false;
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        List<Ast> items = getItems();
        if (items.isEmpty()) {
            out.add(emptySource());
            return;
        }
        out.add(getDelimiters().getOpen());
        printItems(items, ctx, out);
        if (items.size() == 1 && needsTrailingSeparator()) out.add(",");
        out.add(getDelimiters().getClose());
    }

    protected void printItems(List<Ast> items, PrintContext ctx,
                              List<String> out) {
        for (int i = 0; i < items.size(); i++) {
            if (i != 0) out.add(", ");
            printChild(items.get(i), "items", ctx, out);
        }
    }

}
