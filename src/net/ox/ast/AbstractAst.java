package net.ox.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.parser.TokenSource;
import net.ox.util.Formats;

/**
 * Common base of all AST element implementations.
 * This class implements ownership, attributes, free-variable collection,
 * and the generic parts of printing; subclasses provide the storage of
 * their values and children.
 */
public abstract class AbstractAst implements Ast {

    private final AstType type;
    private final Map<String, Object> attributes;
    private Ast parent;

    protected AbstractAst(AstType type) {
        if (type == null)
            throw new NullPointerException("AST type must not be null");
        if (type.isAbstract())
            throw new AbstractInstantiationException(
                "Cannot instantiate abstract AST type " + type.getName());
        if (! type.getJavaClass().isInstance(this))
            throw new ConstructionException("AST type " + type.getName() +
                " does not describe instances of " + getClass().getName());
        this.type = type;
        this.attributes = new LinkedHashMap<String, Object>();
    }

    public AstType getType() {
        return type;
    }

    /**
     * The name of this element's type.
     */
    public String getName() {
        return type.getName();
    }

    public TokenSource.Token getToken() {
        return null;
    }

    public Ast getParent() {
        return parent;
    }

    void setParent(Ast p) {
        parent = p;
    }

    public Object getTag() {
        return null;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public void setAttribute(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
    }

    /**
     * Verify that none of the given elements has a parent (and that none
     * is given twice), then make this their parent.
     * Nothing is linked if the check fails.
     */
    protected void adopt(List<? extends Ast> children) {
        Map<Ast, Boolean> seen = new IdentityHashMap<Ast, Boolean>();
        for (Ast child : children) {
            if (! (child instanceof AbstractAst))
                throw new ConstructionException("Cannot adopt foreign AST " +
                    "element " + AstType.describe(child));
            if (child.getParent() != null)
                throw new OwnershipException("Cannot attach " +
                    child.getName() + " to " + getName() +
                    ": it already belongs to " +
                    child.getParent().getName());
            if (child == this || seen.put(child, Boolean.TRUE) != null)
                throw new OwnershipException("Cannot attach " +
                    child.getName() + " to " + getName() + " twice");
        }
        for (Ast child : children) {
            ((AbstractAst) child).setParent(this);
        }
    }

    /**
     * Detach the given child from this element.
     */
    protected void release(Ast child) {
        if (child.getParent() == this)
            ((AbstractAst) child).setParent(null);
    }

    /**
     * Copy the attributes of this element into the given (fresh) one.
     */
    protected <T extends Ast> T withAttributesOf(T target) {
        target.getAttributes().putAll(attributes);
        return target;
    }

    /**
     * Copy all children of this element.
     */
    protected List<Ast> copyChildren() {
        List<Ast> ret = new ArrayList<Ast>(getChildren().size());
        for (Ast child : getChildren()) ret.add(child.copy());
        return ret;
    }

    public StaticValue getStaticValue() {
        return StaticValue.UNKNOWN;
    }

    public Set<String> getFreeVars() {
        return getFreeVars(Collections.<String>emptySet(),
                           Collections.<String>emptySet());
    }

    public Set<String> getFreeVars(Set<String> exclude,
                                   Set<String> include) {
        Set<String> ret = new LinkedHashSet<String>(include);
        collectFreeVars(exclude, ret);
        return ret;
    }

    /**
     * Add the free variables of this subtree that are not in exclude to
     * out.
     * The default adds the names bound by this element to the exclusions
     * and recurses into all children.
     */
    protected void collectFreeVars(Set<String> exclude, Set<String> out) {
        Set<String> bound = getBoundNames();
        Set<String> inner = exclude;
        if (! bound.isEmpty()) {
            inner = new HashSet<String>(exclude);
            inner.addAll(bound);
        }
        for (Ast child : getChildren()) {
            ((AbstractAst) child).collectFreeVars(inner, out);
        }
    }

    /**
     * The names bound by this element in the scope formed by its
     * children.
     */
    protected Set<String> getBoundNames() {
        return Collections.emptySet();
    }

    public List<String> getTokens(PrintContext ctx) {
        List<String> out = new ArrayList<String>();
        int level = ctx.getLevel();
        printTo(ctx, out);
        if (ctx.getLevel() != level)
            throw new IllegalStateException("Printing " + getName() +
                " left indentation level " + ctx.getLevel() +
                " instead of " + level);
        return out;
    }

    public String getSource() {
        return getSource(new PrintContext());
    }

    public String getSource(PrintContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (String frag : getTokens(ctx)) sb.append(frag);
        return sb.toString();
    }

    /**
     * Append the source fragments of this element to out.
     */
    protected abstract void printTo(PrintContext ctx, List<String> out);

    /**
     * Append the fragments of child (occupying the given role, usually a
     * field name) to out, bracketing it as wrapChild() decides.
     */
    protected void printChild(Ast child, String role, PrintContext ctx,
                              List<String> out) {
        Brackets br = wrapChild(child, role);
        if (br.isWrapping()) out.add(br.getOpen());
        out.addAll(child.getTokens(ctx));
        if (br.isWrapping()) out.add(br.getClose());
    }

    /**
     * Decide whether child needs brackets when printed in the given role.
     */
    protected Brackets wrapChild(Ast child, String role) {
        return Brackets.NONE;
    }

    /**
     * Render a tag or leaf value for toString().
     */
    protected static String formatValue(Object value) {
        if (value instanceof String)
            return Formats.formatString((String) value, '\'');
        if (value instanceof Enum<?>)
            return ((Enum<?>) value).getDeclaringClass().getSimpleName() +
                "." + ((Enum<?>) value).name();
        return String.valueOf(value);
    }

}
