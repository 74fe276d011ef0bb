package net.ox.api;

/**
 * A generic interface for marking objects with textual names.
 * Grammar productions, token patterns, AST type descriptors and parse trees
 * are all named; collections keyed by those names rely on getName() being
 * stable for the lifetime of the object.
 */
public interface NamedValue {

    /**
     * The name of this object.
     */
    String getName();

}
