package net.ox.target.python;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.CoercionException;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.SExprConstructor;
import net.ox.ast.Tree;
import net.ox.ast.Wrapper;
import net.ox.ast.mixins.BlockNode;

/**
 * A sequence of statements, such as a function body or a module.
 * Blocks do not nest directly; statement lists given to of() are
 * flattened.
 */
public class Block extends BlockNode {

    public static final AstType TYPE = AstType.node("Block", Block.class,
                                                    PyNode.ROOT)
        .field("body", Tree.class)
        .symbol("do", new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                return of(h, args);
            }
            public String toString() {
                return "block constructor";
            }
        })
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Block((Tree) args[0]);
            }
        })
        .build();

    public Block(Tree body) {
        super(TYPE, body);
        for (Ast a : body.getChildren()) {
            if (! (a instanceof Stmt))
                throw new ConstructionException("Invalid statement " +
                    a.getName() + " in block");
        }
    }
    public Block(List<? extends Stmt> statements) {
        this(new Tree("body", statements));
    }
    public Block(Stmt... statements) {
        this(Arrays.asList(statements));
    }

    protected String emptyPlaceholder() {
        return "pass";
    }

    /**
     * Convert value into a block.
     * Lists contribute each of their items; expressions become expression
     * statements.
     */
    public static Block of(Hierarchy h, Object value) {
        if (value instanceof Wrapper) value = ((Wrapper) value).unwrap();
        if (value instanceof Block) return (Block) value;
        List<Stmt> stmts = new ArrayList<Stmt>();
        collect(h, value, stmts);
        return new Block(stmts);
    }

    /**
     * Convert value into a single statement.
     */
    public static Stmt statement(Hierarchy h, Object value) {
        if (value instanceof Wrapper) value = ((Wrapper) value).unwrap();
        if (value instanceof List<?> || value instanceof Block) {
            List<Stmt> stmts = new ArrayList<Stmt>();
            collect(h, value, stmts);
            if (stmts.size() != 1)
                throw new CoercionException("Expected a single statement, " +
                    "got " + stmts.size());
            return stmts.get(0);
        }
        Ast node = h.coerce(value);
        if (node instanceof Expr) return new ExprStmt((Expr) node);
        if (node instanceof Stmt) return (Stmt) node;
        throw new CoercionException("Cannot use " + node.getName() +
                                    " as a statement");
    }

    private static void collect(Hierarchy h, Object value, List<Stmt> out) {
        if (value instanceof Wrapper) value = ((Wrapper) value).unwrap();
        if (value instanceof List<?>) {
            for (Object item : (List<?>) value) collect(h, item, out);
        } else if (value instanceof Block) {
            for (Ast a : ((Block) value).getStatements())
                out.add((Stmt) a.copy());
        } else {
            out.add(statement(h, value));
        }
    }

}
