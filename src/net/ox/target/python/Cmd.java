package net.ox.target.python;

import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.Leaf;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;

/**
 * A keyword-only statement: pass, break, or continue.
 */
public class Cmd extends Leaf implements Stmt {

    public enum Kind {
        PASS, BREAK, CONTINUE;

        public String getKeyword() {
            return name().toLowerCase();
        }
    }

    public static final AstType TYPE = AstType.leaf("Cmd", Cmd.class,
                                                    PyNode.STMT, Kind.class)
        .symbol("pass", constructor(Kind.PASS))
        .symbol("break", constructor(Kind.BREAK))
        .symbol("continue", constructor(Kind.CONTINUE))
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Cmd((Kind) args[0]);
            }
        })
        .build();

    public Cmd(Kind kind) {
        super(TYPE, kind);
    }

    public Kind getKind() {
        return (Kind) getValue();
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add(getKind().getKeyword());
    }

    private static SExprConstructor constructor(final Kind kind) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (! args.isEmpty() || ! kwargs.isEmpty())
                    throw new ConstructionException(kind.getKeyword() +
                        " takes no arguments");
                return new Cmd(kind);
            }
            public String toString() {
                return kind.getKeyword() + " constructor";
            }
        };
    }

}
