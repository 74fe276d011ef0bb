package net.ox.ast.mixins;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;
import net.ox.operators.UnaryOperator;

/**
 * A prefix operator application: (op, expr).
 * Word operators (such as "not") are separated from their operand by a
 * space; symbols are not.
 */
public abstract class UnaryOpNode extends OperatorNode {

    protected UnaryOpNode(AstType type, UnaryOperator op, Ast expr) {
        super(type, op, expr);
    }

    public UnaryOperator getOperator() {
        return (UnaryOperator) getTag();
    }

    public Ast getExpression() {
        return getChild(0);
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        String sym = getOperator().getSymbol();
        out.add(Character.isLetter(sym.charAt(sym.length() - 1)) ?
                sym + " " : sym);
        printChild(getExpression(), "expr", ctx, out);
    }

    protected Brackets wrapChild(Ast child, String role) {
        if (precedenceOf(child) < getPrecedence()) return Brackets.PARENS;
        return Brackets.NONE;
    }

    protected Ast fromStaticChildren(Object... values) {
        UnaryOperator op = getOperator();
        if (! op.canApply(values[0])) return null;
        return withAttributesOf(constant(op.apply(values[0])));
    }

    /**
     * An S-expression constructor applying op to exactly one (coerced)
     * operand.
     */
    public static SExprConstructor operatorConstructor(
            final Class<? extends Ast> cls, final UnaryOperator op) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() != 1)
                    throw new ConstructionException("Operator " +
                        op.getSymbol() + " expects exactly one operand, " +
                        "got " + args.size());
                return h.construct(cls, Arrays.asList(op,
                    h.coerce(args.get(0))), kwargs);
            }
            public String toString() {
                return "unary " + op.getSymbol() + " constructor of " +
                    cls.getSimpleName();
            }
        };
    }

    /**
     * Register one constructor per operator of ops under the operator
     * itself, and under its symbol unless the symbol is in skip.
     */
    public static AstType.Builder declareOperators(AstType.Builder b,
            Class<? extends Ast> cls, UnaryOperator[] ops,
            Set<String> skip) {
        if (skip == null) skip = Collections.emptySet();
        for (UnaryOperator op : ops) {
            SExprConstructor ctor = operatorConstructor(cls, op);
            b.symbol(op, ctor);
            if (! skip.contains(op.getSymbol()))
                b.symbol(op.getSymbol(), ctor);
        }
        return b;
    }

}
