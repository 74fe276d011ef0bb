package net.ox.ast;

/**
 * The generic syntax hierarchy.
 * Its root is the abstract type "Syntax"; its members are Tree and Token,
 * the untyped elements produced by parsers that have no reducers bound.
 */
public final class Syntax {

    public static final AstType ROOT =
        AstType.root("Syntax", Ast.class).build();

    /* Built on first use, since Tree and Token refer to ROOT. */
    private static class Holder {

        static final Hierarchy HIERARCHY = Hierarchy.builder(ROOT)
            .add(Tree.TYPE, Token.TYPE)
            .build();

    }

    private Syntax() {}

    public static Hierarchy getHierarchy() {
        return Holder.HIERARCHY;
    }

}
