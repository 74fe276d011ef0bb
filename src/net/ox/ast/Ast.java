package net.ox.ast;

import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.api.parser.Parser;

/**
 * An element of an abstract syntax tree.
 * An Ast is either a Node (fixed-arity, named fields), a Leaf (a single
 * value, no children), or a Tree (a tag and any amount of children); its
 * AstType describes which. Every element is owned by at most one parent;
 * attaching an element that already has a parent elsewhere raises an
 * OwnershipException. Besides its children, an element carries an optional
 * tag and a map of attributes (metadata such as source positions) which do
 * not take part in equality.
 * Equality is structural: two elements are equal if their types, tags (or
 * leaf values), and children are pairwise equal, regardless of parents and
 * attributes.
 * Implementations must extend AbstractAst.
 */
public interface Ast extends Parser.ParseTree {

    /**
     * The descriptor of this element's type.
     */
    AstType getType();

    /**
     * The element that owns this one, or null.
     */
    Ast getParent();

    /**
     * An immutable (live) view of the children of this element.
     */
    List<Ast> getChildren();

    /**
     * The tag of this element, or null.
     */
    Object getTag();

    /**
     * The (modifiable) attribute map of this element.
     */
    Map<String, Object> getAttributes();

    /**
     * Retrieve the named attribute, or null.
     */
    Object getAttribute(String name);

    /**
     * Set (or, if value is null, remove) the named attribute.
     */
    void setAttribute(String name, Object value);

    /**
     * Create a parentless deep copy of this element.
     * Tags and attributes are shallow-copied; children are copied
     * recursively.
     */
    Ast copy();

    /**
     * Return a constant-folded copy of this element.
     * Subtrees whose children all have known static values are replaced by
     * whatever their types fold them into; others are rebuilt from their
     * simplified children. The result never shares elements with this tree.
     */
    Ast simplify();

    /**
     * The compile-time value of this element, or StaticValue.UNKNOWN.
     */
    StaticValue getStaticValue();

    /**
     * The names of the variables occurring free in this subtree.
     */
    Set<String> getFreeVars();

    /**
     * The free variables of this subtree that are not in exclude, plus
     * all names in include.
     * Binding constructs add the names they bind to exclude for everything
     * in their scope.
     */
    Set<String> getFreeVars(Set<String> exclude, Set<String> include);

    /**
     * Render this element into a list of source text fragments.
     * The context's indentation level is restored when this returns.
     */
    List<String> getTokens(PrintContext ctx);

    /**
     * Render this element into source text using a fresh PrintContext.
     */
    String getSource();

    /**
     * Render this element into source text using the given context.
     */
    String getSource(PrintContext ctx);

}
