package net.ox.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.ox.api.NamedValue;

/**
 * An AST element with a fixed set of named fields.
 * The fields are described by the node's AstType: an optional tag, a
 * contiguous run of children, and attributes. Constructing a node validates
 * the arguments against the fields (naming the offending field on errors)
 * and takes ownership of the children.
 */
public abstract class Node extends AbstractAst {

    private final Object tag;
    private final Ast[] children;
    private final List<Ast> childrenView;

    protected Node(AstType type, Object... args) {
        super(type);
        if (! type.isNode())
            throw new ConstructionException("AST type " + type.getName() +
                " does not describe nodes");
        args = type.checkArguments(args);
        AstType.Field tf = type.getTagField();
        tag = (tf == null) ? null : args[tf.getIndex()];
        List<AstType.Field> cf = type.getChildFields();
        children = new Ast[cf.size()];
        for (int i = 0; i < children.length; i++) {
            children[i] = (Ast) args[cf.get(i).getIndex()];
        }
        childrenView = Collections.unmodifiableList(Arrays.asList(children));
        adopt(childrenView);
        for (AstType.Field f : type.getAttributeFields()) {
            setAttribute(f.getName(), args[f.getIndex()]);
        }
    }

    public String toString() {
        StringBuilder sb = new StringBuilder(getName()).append('(');
        boolean first = true;
        if (tag != null) {
            sb.append(formatValue(tag));
            first = false;
        }
        for (Ast child : children) {
            if (! first) sb.append(", ");
            sb.append(child);
            first = false;
        }
        return sb.append(')').toString();
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (! (other instanceof Node)) return false;
        Node n = (Node) other;
        if (n.getType() != getType()) return false;
        if ((tag == null) ? n.tag != null : ! tag.equals(n.tag))
            return false;
        return Arrays.equals(children, n.children);
    }

    public int hashCode() {
        return getType().getName().hashCode() ^
            ((tag == null) ? 0 : tag.hashCode()) ^
            Arrays.hashCode(children);
    }

    public Object getTag() {
        return tag;
    }

    public List<Ast> getChildren() {
        return childrenView;
    }

    public Ast getChild(int index) {
        return children[index];
    }

    /**
     * The child stored in the named field.
     */
    public Ast getChild(String field) {
        return children[childIndex(field)];
    }

    /**
     * Replace the child stored in the named field.
     * The previous child is detached; the new one must not have a parent.
     */
    public void setChild(String field, Ast child) {
        setChild(childIndex(field), child);
    }

    public void setChild(int index, Ast child) {
        AstType.Field f = getType().getChildFields().get(index);
        if (! f.accepts(child))
            throw new ConstructionException("Invalid value for field " +
                f.getName() + " of " + getName() + ": expected " +
                f.getType().getSimpleName() + ", got " +
                AstType.describe(child));
        if (children[index] == child) return;
        adopt(Collections.singletonList(child));
        release(children[index]);
        children[index] = child;
    }

    private int childIndex(String field) {
        List<AstType.Field> cf = getType().getChildFields();
        for (int i = 0; i < cf.size(); i++) {
            if (cf.get(i).getName().equals(field)) return i;
        }
        throw new IllegalArgumentException("AST type " + getName() +
            " has no child field " + field);
    }

    /**
     * The constructor arguments that would recreate this node with the
     * given children.
     */
    protected Object[] toArguments(List<Ast> newChildren) {
        List<AstType.Field> fields = getType().getFields();
        Object[] args = new Object[fields.size()];
        int ci = 0;
        for (AstType.Field f : fields) {
            switch (f.getRole()) {
                case TAG:
                    args[f.getIndex()] = tag;
                    break;
                case CHILD:
                    args[f.getIndex()] = newChildren.get(ci++);
                    break;
                default:
                    args[f.getIndex()] = getAttribute(f.getName());
                    break;
            }
        }
        return args;
    }

    /**
     * Create a node of the same type and tag, with the given children and
     * this node's attributes.
     */
    protected Ast rebuild(List<Ast> newChildren) {
        return withAttributesOf(getType().create(toArguments(newChildren)));
    }

    public Ast copy() {
        return rebuild(copyChildren());
    }

    public Ast simplify() {
        Ast folded = fold(this);
        if (folded != null) return folded;
        List<Ast> simplified = new ArrayList<Ast>(children.length);
        for (Ast child : children) simplified.add(child.simplify());
        Ast ret = rebuild(simplified);
        if (ret instanceof Node) {
            folded = fold((Node) ret);
            if (folded != null) return folded;
        }
        return ret;
    }

    private static Ast fold(Node node) {
        List<Ast> kids = node.getChildren();
        Object[] values = new Object[kids.size()];
        for (int i = 0; i < values.length; i++) {
            StaticValue sv = kids.get(i).getStaticValue();
            if (! sv.isKnown()) return null;
            values[i] = sv.getValue();
        }
        return node.fromStaticChildren(values);
    }

    /**
     * Fold this node given the static values of all of its children.
     * Returns null if the node cannot be folded (the default).
     */
    protected Ast fromStaticChildren(Object... values) {
        return null;
    }

    /**
     * Render the node's tag for printing.
     */
    protected String formatTag() {
        if (tag instanceof NamedValue) return ((NamedValue) tag).getName();
        return String.valueOf(tag);
    }

    /**
     * Render the named attribute for printing.
     */
    protected String formatAttribute(String name) {
        return String.valueOf(getAttribute(name));
    }

    /**
     * Print the node using its type's template if there is one, and as
     * a call-like Type(child, ...) sequence otherwise.
     */
    protected void printTo(PrintContext ctx, List<String> out) {
        Template tmpl = getType().getTemplate();
        if (tmpl == null) {
            out.add(getName());
            out.add("(");
            for (int i = 0; i < children.length; i++) {
                if (i != 0) out.add(", ");
                printChild(children[i], getType().getChildFields().get(i)
                    .getName(), ctx, out);
            }
            out.add(")");
            return;
        }
        printTemplate(tmpl, ctx, out);
    }

    protected void printTemplate(Template tmpl, PrintContext ctx,
                                 List<String> out) {
        for (Template.Part part : tmpl.getParts()) {
            if (! part.isPlaceholder()) {
                out.add(part.getText());
                continue;
            }
            AstType.Field f = getType().getField(part.getText());
            switch (f.getRole()) {
                case TAG:
                    out.add(formatTag());
                    break;
                case CHILD:
                    printChild(getChild(f.getName()), f.getName(), ctx,
                               out);
                    break;
                default:
                    out.add(formatAttribute(f.getName()));
                    break;
            }
        }
    }

}
