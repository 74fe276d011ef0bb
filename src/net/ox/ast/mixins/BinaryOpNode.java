package net.ox.ast.mixins;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.ox.ast.Ast;
import net.ox.ast.AstType;
import net.ox.ast.Brackets;
import net.ox.ast.ConstructionException;
import net.ox.ast.Hierarchy;
import net.ox.ast.PrintContext;
import net.ox.ast.SExprConstructor;
import net.ox.operators.BinaryOperator;
import net.ox.operators.UnaryOperator;

/**
 * An infix operator application: (op, lhs, rhs).
 * Printed as "lhs op rhs"; an operand is bracketed if it binds more
 * loosely than the operator, or equally on the non-associative side
 * (unless it applies the same associative operator).
 */
public abstract class BinaryOpNode extends OperatorNode {

    protected BinaryOpNode(AstType type, BinaryOperator op, Ast lhs,
                           Ast rhs) {
        super(type, op, lhs, rhs);
    }

    public BinaryOperator getOperator() {
        return (BinaryOperator) getTag();
    }

    public Ast getLhs() {
        return getChild(0);
    }

    public Ast getRhs() {
        return getChild(1);
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        printChild(getLhs(), "lhs", ctx, out);
        out.add(" " + getOperator().getSymbol() + " ");
        printChild(getRhs(), "rhs", ctx, out);
    }

    /* On a precedence tie, the operand on the side the operator does not
     * associate towards is bracketed, except for a nested application of
     * the same associative operator. */
    protected Brackets wrapChild(Ast child, String role) {
        int cp = precedenceOf(child);
        if (cp < getPrecedence()) return Brackets.PARENS;
        if (cp == getPrecedence() &&
                "lhs".equals(role) == getOperator().isRightAssociative() &&
                ! sameAssociativeOperator(child))
            return Brackets.PARENS;
        return Brackets.NONE;
    }

    private boolean sameAssociativeOperator(Ast child) {
        return getOperator().isAssociative() &&
            child instanceof BinaryOpNode &&
            ((BinaryOpNode) child).getOperator() == getOperator();
    }

    protected Ast fromStaticChildren(Object... values) {
        BinaryOperator op = getOperator();
        if (! op.canApply(values[0], values[1])) return null;
        return withAttributesOf(constant(op.apply(values[0], values[1])));
    }

    /**
     * An S-expression constructor applying op to two or more operands.
     * Operands are coerced; longer argument lists are folded to the left
     * or, for right-associative operators, to the right. Every node built
     * is created through the constructor registered for cls.
     */
    public static SExprConstructor operatorConstructor(
            final Class<? extends Ast> cls, final BinaryOperator op) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() < 2)
                    throw new ConstructionException("Operator " +
                        op.getSymbol() + " expects at least two operands, " +
                        "got " + args.size());
                List<Ast> operands = new ArrayList<Ast>(args.size());
                for (Object a : args) operands.add(h.coerce(a));
                if (op.isRightAssociative()) {
                    int i = operands.size() - 1;
                    Ast ret = operands.get(i);
                    while (i-- > 0)
                        ret = h.construct(cls, Arrays.asList(op,
                            operands.get(i), ret), kwargs);
                    return ret;
                }
                Ast ret = operands.get(0);
                for (int i = 1; i < operands.size(); i++)
                    ret = h.construct(cls, Arrays.asList(op, ret,
                        operands.get(i)), kwargs);
                return ret;
            }
            public String toString() {
                return "binary " + op.getSymbol() + " constructor of " +
                    cls.getSimpleName();
            }
        };
    }

    /**
     * An S-expression constructor dispatching to unary for a single
     * argument and to binary otherwise (e.g. for "-").
     */
    public static SExprConstructor flexibleConstructor(
            final SExprConstructor unary, final SExprConstructor binary) {
        return new SExprConstructor() {
            public Ast construct(Hierarchy h, List<?> args,
                                 Map<String, ?> kwargs) {
                if (args.size() == 1)
                    return unary.construct(h, args, kwargs);
                return binary.construct(h, args, kwargs);
            }
            public String toString() {
                return "flexible constructor (" + unary + " / " + binary +
                    ")";
            }
        };
    }

    /**
     * Register one constructor per operator of ops, under the operator
     * itself and under its symbol.
     * Symbols that unaryOps also uses as unary operators get a flexible
     * constructor.
     */
    public static AstType.Builder declareOperators(AstType.Builder b,
            Class<? extends Ast> cls, BinaryOperator[] ops,
            Class<? extends Ast> unaryCls,
            UnaryOperator[] unaryOps) {
        for (BinaryOperator op : ops) {
            SExprConstructor ctor = operatorConstructor(cls, op);
            b.symbol(op, ctor);
            UnaryOperator uop = null;
            if (unaryOps != null) {
                for (UnaryOperator u : unaryOps) {
                    if (u.getSymbol().equals(op.getSymbol())) uop = u;
                }
            }
            if (uop == null) {
                b.symbol(op.getSymbol(), ctor);
            } else {
                b.symbol(op.getSymbol(), flexibleConstructor(
                    UnaryOpNode.operatorConstructor(unaryCls, uop), ctor));
            }
        }
        return b;
    }

}
