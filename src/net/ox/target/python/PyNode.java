package net.ox.target.python;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.mixins.OperatorNode;

/**
 * The root and the abstract intermediate types of the Python-like AST
 * hierarchy, along with the binding strengths used for bracketing.
 * Node classes only refer to this class, so that their descriptors can be
 * built before the hierarchy (see Py) is.
 */
public final class PyNode {

    public static final AstType ROOT = AstType.root("PyNode", Ast.class)
        .build();

    public static final AstType EXPR = AstType.abstractType("Expr",
        Expr.class, ROOT).build();

    public static final AstType STMT = AstType.abstractType("Stmt",
        Stmt.class, ROOT).build();

    /** Binding strength of lambda expressions. */
    public static final int LEVEL_LAMBDA = -2;

    /** Binding strength of conditional expressions. */
    public static final int LEVEL_TERNARY = 0;

    /** Binding strength of names, literals, calls, and displays. */
    public static final int LEVEL_PRIMARY = 100;

    public static final Set<String> KEYWORDS = Collections.unmodifiableSet(
        new HashSet<String>(Arrays.asList(
            "False", "None", "True", "and", "as", "assert", "async",
            "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if",
            "import", "in", "is", "lambda", "nonlocal", "not", "or",
            "pass", "raise", "return", "try", "while", "with", "yield")));

    private PyNode() {}

    /**
     * How tightly node binds when it appears as an operand.
     * Negative numeric literals bind like a unary minus.
     */
    public static int level(Ast node) {
        if (node instanceof Lambda) return LEVEL_LAMBDA;
        if (node instanceof Ternary) return LEVEL_TERNARY;
        if (node instanceof OperatorNode)
            return ((OperatorNode) node).getPrecedence();
        if (node instanceof Atom && ((Atom) node).isNegative())
            return PyUnaryOp.NEG.getPrecedence();
        return LEVEL_PRIMARY;
    }

}
