package net.ox.target.python;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.ValueTransform;
import net.ox.ast.Ast;
import net.ox.ast.Token;
import net.ox.ast.Tree;
import net.ox.operators.ChainBuilder;
import net.ox.operators.Operators;
import net.ox.util.Formats;
import net.ox.util.Logging;
import net.ox.util.parser.CompiledLexer;
import net.ox.util.parser.LexerCompiler;
import net.ox.util.parser.ParserCompiler;
import net.ox.util.parser.RuleSet;

/**
 * A parser for Python-like expressions producing the AST of this package.
 * Supported are literals, names, the usual operators (with Python's
 * precedences), conditional expressions, lambdas, attribute access,
 * subscription, calls with keyword arguments, and tuple, list, set and
 * dict displays. Comparison chains are folded into nested comparisons.
 */
public final class PyGrammar {

    private static class ParserHolder {

        public static final Parser INSTANCE;

        static {
            try {
                INSTANCE = new ParserCompiler().compile(createLexer(),
                                                        createRules());
            } catch (InvalidGrammarException exc) {
                throw compileFailure(exc);
            }
            LOGGER.fine("Compiled expression parser");
        }

    }

    private static final Logger LOGGER = Logging.getLogger("PyGrammar");

    private static final ChainBuilder BINOP_BUILDER = new ChainBuilder() {
        public Object build(Object op, Object lhs, Object rhs) {
            return new BinOp((PyBinaryOp) op, (Expr) lhs, (Expr) rhs);
        }
    };

    private PyGrammar() {}

    static RuntimeException compileFailure(InvalidGrammarException exc) {
        LOGGER.log(Level.SEVERE, "Cannot compile expression parser", exc);
        return new RuntimeException(exc);
    }

    public static Parser getParser() {
        return ParserHolder.INSTANCE;
    }

    /**
     * Parse source into an expression.
     */
    public static Expr parse(String source) throws ParsingException {
        return (Expr) getParser().parse(source);
    }

    static CompiledLexer createLexer() throws InvalidGrammarException {
        return new LexerCompiler()
            .token("NAME", "[A-Za-z_][A-Za-z0-9_]*")
            .token("FLOAT", "[0-9]+\\.[0-9]*(?:[eE][-+]?[0-9]+)?|" +
                   "\\.[0-9]+(?:[eE][-+]?[0-9]+)?|[0-9]+[eE][-+]?[0-9]+",
                   new ValueTransform() {
                       public Object transform(String raw) {
                           return Double.valueOf(raw);
                       }
                   })
            .token("INT", "[0-9]+", new ValueTransform() {
                public Object transform(String raw) {
                    return Long.valueOf(raw);
                }
            })
            .token("STRING", "\"(?:[^\"\\\\\\n]|\\\\.)*\"|" +
                   "'(?:[^'\\\\\\n]|\\\\.)*'", new ValueTransform() {
                public Object transform(String raw) {
                    return Formats.parseStringLiteral(raw);
                }
            })
            .token("BINOP", "//|<<|>>|<=|>=|==|!=|[-+*/%@&|^<>]|" +
                   "(?:not\\s+in|is\\s+not|is|in)\\b", new ValueTransform() {
                public Object transform(String raw) {
                    return PyBinaryOp.fromSymbol(raw);
                }
            })
            .token("UNARY", "[-+~]", new ValueTransform() {
                public Object transform(String raw) {
                    return PyUnaryOp.fromSymbol(raw);
                }
            })
            .token("WS", "\\s+")
            .ignore("WS")
            .compile();
    }

    static RuleSet createRules() throws InvalidGrammarException {
        RuleSet.NamedReducer dict = RuleSet.named("dict", new Reducer() {
            public Object reduce(Object... children) {
                return new DictExpr(exprs(children, 0));
            }
        });
        return new RuleSet()
            .rule("start", "test")
            .rule("test", "disj \"if\" disj \"else\" test",
                  RuleSet.named("ternary", new Reducer() {
                public Object reduce(Object... children) {
                    return new Ternary((Expr) children[1],
                        (Expr) children[0], (Expr) children[2]);
                }
            }))
            .rule("test", "disj")
            .rule("test", "\"lambda\" [_params] \":\" test",
                  RuleSet.named("lambda", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    List<Ast> params = new ArrayList<Ast>();
                    for (int i = 0; i < children.length - 1; i++) {
                        params.add(new Name((String) value(children[i])));
                    }
                    return new Lambda(new Tree("args", params),
                        (Expr) children[children.length - 1]);
                }
            }))
            .rule("_params", "NAME (\",\" NAME)*")
            .rule("disj", "conj \"or\" disj",
                  RuleSet.named("or", new Reducer() {
                public Object reduce(Object... children) {
                    return new Or((Expr) children[0], (Expr) children[1]);
                }
            }))
            .rule("disj", "conj")
            .rule("conj", "neg \"and\" conj",
                  RuleSet.named("and", new Reducer() {
                public Object reduce(Object... children) {
                    return new And((Expr) children[0], (Expr) children[1]);
                }
            }))
            .rule("conj", "neg")
            .rule("neg", "\"not\" neg", RuleSet.named("not", new Reducer() {
                public Object reduce(Object... children) {
                    return new UnaryOp(PyUnaryOp.NOT, (Expr) children[0]);
                }
            }))
            .rule("neg", "chain")
            .rule("chain", "factor (BINOP factor)*",
                  RuleSet.named("binop", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    List<Object> chain = new ArrayList<Object>();
                    for (int i = 0; i < children.length; i++) {
                        chain.add((i % 2 == 0) ? children[i] :
                                  value(children[i]));
                    }
                    return Operators.reduceChain(chain, BINOP_BUILDER);
                }
            }))
            .rule("factor", "UNARY factor",
                  RuleSet.named("unary", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return new UnaryOp((PyUnaryOp) value(children[0]),
                                       (Expr) children[1]);
                }
            }))
            .rule("factor", "power")
            .rule("power", "primary \"**\" factor",
                  RuleSet.named("pow", new Reducer() {
                public Object reduce(Object... children) {
                    return new BinOp(PyBinaryOp.POW, (Expr) children[0],
                                     (Expr) children[1]);
                }
            }))
            .rule("power", "primary")
            .rule("primary", "primary \".\" NAME",
                  RuleSet.named("getattr", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return new GetAttr((Expr) children[0],
                                       (String) value(children[1]));
                }
            }))
            .rule("primary", "primary \"[\" test \"]\"",
                  RuleSet.named("getitem", new Reducer() {
                public Object reduce(Object... children) {
                    return new GetItem((Expr) children[0],
                                       (Expr) children[1]);
                }
            }))
            .rule("primary", "primary \"(\" [_args] \")\"",
                  RuleSet.named("call", new Reducer() {
                public Object reduce(Object... children) {
                    List<Ast> args = new ArrayList<Ast>();
                    for (int i = 1; i < children.length; i++) {
                        args.add((Ast) children[i]);
                    }
                    return new Call((Expr) children[0],
                                    new Tree("args", args));
                }
            }))
            .rule("primary", "atom")
            .rule("_args", "_arg (\",\" _arg)* [\",\"]")
            .rule("_arg", "NAME \"=\" test",
                  RuleSet.named("kwarg", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return new ArgDef((String) value(children[0]),
                                      (Expr) children[1]);
                }
            }))
            .rule("_arg", "test")
            .rule("atom", "NAME", RuleSet.named("name", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return new Name((String) value(children[0]));
                }
            }))
            .rule("atom", "INT | FLOAT | STRING",
                  RuleSet.named("literal", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return new Atom(value(children[0]));
                }
            }))
            .rule("atom", "\"True\"", constant("true", Boolean.TRUE))
            .rule("atom", "\"False\"", constant("false", Boolean.FALSE))
            .rule("atom", "\"None\"", constant("none", null))
            .rule("atom", "\"(\" \")\"", RuleSet.named("unit", new Reducer() {
                public Object reduce(Object... children) {
                    return new Tuple();
                }
            }))
            .rule("atom", "\"(\" test \")\"")
            .rule("atom", "\"(\" test \",\" [_items] \")\"",
                  RuleSet.named("tuple", new Reducer() {
                public Object reduce(Object... children) {
                    return new Tuple(exprs(children, 0));
                }
            }))
            .rule("atom", "\"[\" [_items] \"]\"",
                  RuleSet.named("list", new Reducer() {
                public Object reduce(Object... children) {
                    return new ListExpr(exprs(children, 0));
                }
            }))
            .rule("atom", "\"{\" \"}\"", dict)
            .rule("atom", "\"{\" _pairs \"}\"", dict)
            .rule("atom", "\"{\" _items \"}\"",
                  RuleSet.named("set", new Reducer() {
                public Object reduce(Object... children) {
                    return new SetExpr(exprs(children, 0));
                }
            }))
            .rule("_items", "test (\",\" test)* [\",\"]")
            .rule("_pairs", "_pair (\",\" _pair)* [\",\"]")
            .rule("_pair", "test \":\" test");
    }

    private static RuleSet.NamedReducer constant(String name,
                                                 final Object value) {
        return RuleSet.named(name, new Reducer() {
            public Object reduce(Object... children) {
                return new Atom(value);
            }
        });
    }

    private static Object value(Object token) throws MappingException {
        if (! (token instanceof Token))
            throw new MappingException("Expected a token, got " + token);
        return ((Token) token).getValue();
    }

    private static Tree exprs(Object[] children, int from) {
        List<Ast> items = new ArrayList<Ast>();
        for (Object c : Arrays.asList(children).subList(from,
                                                        children.length)) {
            items.add((Expr) c);
        }
        return new Tree("items", items);
    }

}
