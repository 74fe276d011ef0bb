package net.ox.target.python;

import java.util.regex.Pattern;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.mixins.NameLeaf;

/**
 * A variable reference.
 */
public class Name extends NameLeaf implements Expr {

    public static final Pattern IDENTIFIER = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*");

    public static final AstType TYPE = AstType.leaf("Name", Name.class,
                                                    PyNode.EXPR, String.class)
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Name((String) args[0]);
            }
        })
        .build();

    public Name(String name) {
        super(TYPE, name);
        if (! isIdentifier(name))
            throw new ConstructionException("Invalid name " + name);
    }

    /**
     * Whether s is an identifier and not a keyword.
     */
    public static boolean isIdentifier(String s) {
        return IDENTIFIER.matcher(s).matches() &&
            ! PyNode.KEYWORDS.contains(s);
    }

}
