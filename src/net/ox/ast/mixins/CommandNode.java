package net.ox.ast.mixins;

import java.util.List;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;

/**
 * A statement consisting of a keyword and an optional expression, such as
 * "return x".
 * The type's template prints the full form; when isEmptyExpression()
 * holds for the expression, only the keyword is printed.
 */
public abstract class CommandNode extends Node {

    private final String keyword;

    protected CommandNode(AstType type, String keyword, Ast expr) {
        super(type, expr);
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public Ast getExpression() {
        return getChild(0);
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        if (isEmptyExpression(getExpression())) {
            out.add(keyword);
            return;
        }
        super.printTo(ctx, out);
    }

    /**
     * Whether expr stands for "no value" and may be left out.
     */
    protected boolean isEmptyExpression(Ast expr) {
        return false;
    }

}
