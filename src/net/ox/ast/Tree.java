package net.ox.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A generic, untyped AST element: a tag plus any amount of children.
 * Trees are what parsers produce for rules that have no reducer bound,
 * and serve as argument lists and other variadic fragments inside typed
 * trees.
 */
public class Tree extends AbstractAst {

    public static final AstType TYPE = AstType.tree("Tree", Tree.class,
                                                    Syntax.ROOT)
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                if (args.length == 0)
                    throw new ConstructionException(
                        "Tree expects at least a tag");
                if (args.length == 2 && args[1] instanceof List<?>)
                    return of(args[0], (List<?>) args[1]);
                return of(args[0], Arrays.asList(args).subList(1,
                                                             args.length));
            }
        })
        .build();

    private final Object tag;
    private final List<Ast> children;
    private final List<Ast> childrenView;

    public Tree(Object tag, List<? extends Ast> children) {
        super(TYPE);
        if (tag == null)
            throw new ConstructionException("Tree tag must not be null");
        this.tag = tag;
        this.children = new ArrayList<Ast>(children);
        this.childrenView = Collections.unmodifiableList(this.children);
        adopt(this.children);
    }
    public Tree(Object tag, Ast... children) {
        this(tag, Arrays.asList(children));
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("Tree(");
        sb.append(formatValue(tag)).append(", [");
        boolean first = true;
        for (Ast child : children) {
            if (! first) sb.append(", ");
            sb.append(child);
            first = false;
        }
        return sb.append("])").toString();
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (! (other instanceof Tree)) return false;
        Tree t = (Tree) other;
        return tag.equals(t.tag) && children.equals(t.children);
    }

    public int hashCode() {
        return tag.hashCode() ^ children.hashCode();
    }

    /**
     * The tag, as a string.
     */
    public String getName() {
        return String.valueOf(tag);
    }

    public Object getTag() {
        return tag;
    }

    public List<Ast> getChildren() {
        return childrenView;
    }

    /**
     * Detach all children from this tree and return them.
     * The tree is empty afterwards.
     */
    public List<Ast> release() {
        List<Ast> ret = new ArrayList<Ast>(children);
        for (Ast child : ret) release(child);
        children.clear();
        return ret;
    }

    public Ast copy() {
        return withAttributesOf(new Tree(tag, copyChildren()));
    }

    public Ast simplify() {
        List<Ast> simplified = new ArrayList<Ast>(children.size());
        for (Ast child : children) simplified.add(child.simplify());
        return withAttributesOf(new Tree(tag, simplified));
    }

    /**
     * Print as an S-expression: (tag child ...).
     */
    protected void printTo(PrintContext ctx, List<String> out) {
        out.add("(");
        out.add(getName());
        for (Ast child : children) {
            out.add(" ");
            printChild(child, null, ctx, out);
        }
        out.add(")");
    }

    /**
     * Create a Tree from arbitrary items; values that are not AST elements
     * are boxed into VALUE tokens.
     */
    public static Tree of(Object tag, List<?> items) {
        List<Ast> children = new ArrayList<Ast>(items.size());
        for (Object item : items) {
            if (item instanceof Ast) {
                children.add((Ast) item);
            } else {
                children.add(new Token(item, Token.VALUE_TYPE));
            }
        }
        return new Tree(tag, children);
    }

}
