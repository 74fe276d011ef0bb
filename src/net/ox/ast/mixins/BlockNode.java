package net.ox.ast.mixins;

import java.util.List;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Node;
import net.ox.ast.PrintContext;
import net.ox.ast.Tree;

/**
 * An indented sequence of statements held in a Tree child named "body".
 * Every statement is printed on lines of its own at the current
 * indentation level; an empty block prints a placeholder statement.
 */
public abstract class BlockNode extends Node {

    protected BlockNode(AstType type, Tree body) {
        super(type, body);
    }

    public Tree getBodyTree() {
        return (Tree) getChild(0);
    }

    public List<Ast> getStatements() {
        return getBodyTree().getChildren();
    }

    /**
     * The statement printed for an empty block.
     */
    protected abstract String emptyPlaceholder();

    protected void printTo(PrintContext ctx, List<String> out) {
        List<Ast> stmts = getStatements();
        if (stmts.isEmpty()) {
            out.add(ctx.startLine());
            out.add(emptyPlaceholder());
            out.add("\n");
            return;
        }
        for (Ast stmt : stmts) {
            out.add(ctx.startLine());
            List<String> tokens = stmt.getTokens(ctx);
            out.addAll(tokens);
            if (tokens.isEmpty() || ! tokens.get(tokens.size() - 1)
                    .endsWith("\n"))
                out.add("\n");
        }
    }

    /**
     * Print this block as the body of a compound statement: a colon, then
     * the statements one level deeper.
     */
    public void printBlock(PrintContext ctx, List<String> out) {
        out.add(":\n");
        ctx.indent();
        try {
            out.addAll(getTokens(ctx));
        } finally {
            ctx.dedent();
        }
    }

}
