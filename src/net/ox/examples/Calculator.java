package net.ox.examples;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.ValueTransform;
import net.ox.ast.Token;
import net.ox.util.Logging;
import net.ox.util.parser.CompiledLexer;
import net.ox.util.parser.LexerCompiler;
import net.ox.util.parser.ParserCompiler;
import net.ox.util.parser.RuleSet;

/**
 * A small calculator built from a declarative lexer and rule table.
 * Expressions are parsed into nested (operator, lhs, rhs) lists over
 * numbers and variable names; "name = expr" parses into a single-entry
 * map. The evaluator runs these against a variable environment.
 */
public class Calculator {

    private static class ParserHolder {

        public static final Parser INSTANCE;

        static {
            try {
                INSTANCE = new ParserCompiler().compile(createLexer(),
                                                        createRules());
            } catch (InvalidGrammarException exc) {
                throw compileFailure(exc);
            }
            LOGGER.fine("Compiled calculator parser");
        }

    }

    private static final Logger LOGGER = Logging.getLogger("Calculator");

    private static final Reducer BINOP = new Reducer() {
        public Object reduce(Object... children) throws MappingException {
            return Collections.unmodifiableList(Arrays.asList(
                value(children[1]), children[0], children[2]));
        }
    };

    private final Map<String, Double> env;

    public Calculator(Map<String, Double> env) {
        this.env = env;
    }
    public Calculator() {
        this(new HashMap<String, Double>());
    }

    public String toString() {
        return String.format("%s@%h[env=%s]", getClass().getName(), this,
                             env);
    }

    public Map<String, Double> getEnvironment() {
        return env;
    }

    /**
     * Parse and evaluate src.
     */
    public double eval(String src) throws ParsingException {
        return eval(parse(src));
    }

    /**
     * Evaluate a parsed expression.
     * Numbers evaluate to themselves, names to their values in the
     * environment, operator lists to the operator applied to their
     * operands; assignments store their value and evaluate to it.
     */
    public double eval(Object node) {
        if (node instanceof Double) return (Double) node;
        if (node instanceof String) {
            Double ret = env.get(node);
            if (ret == null)
                throw new IllegalArgumentException("Undefined variable " +
                                                   node);
            return ret;
        }
        if (node instanceof List<?>) {
            List<?> l = (List<?>) node;
            return apply((String) l.get(0), eval(l.get(1)), eval(l.get(2)));
        }
        if (node instanceof Map<?, ?>) {
            Double ret = null;
            for (Map.Entry<?, ?> ent : ((Map<?, ?>) node).entrySet()) {
                ret = eval(ent.getValue());
                env.put((String) ent.getKey(), ret);
            }
            if (ret == null)
                throw new IllegalArgumentException("Empty assignment");
            return ret;
        }
        throw new IllegalArgumentException("Cannot evaluate " + node);
    }

    static RuntimeException compileFailure(InvalidGrammarException exc) {
        LOGGER.log(Level.SEVERE, "Cannot compile calculator parser", exc);
        return new RuntimeException(exc);
    }

    public static Parser getParser() {
        return ParserHolder.INSTANCE;
    }

    public static Object parse(String src) throws ParsingException {
        return getParser().parse(src);
    }

    private static double apply(String op, double x, double y) {
        switch (op) {
            case "+": return x + y;
            case "-": return x - y;
            case "*": return x * y;
            case "/": return x / y;
            case "^": return Math.pow(x, y);
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static Object value(Object token) throws MappingException {
        if (! (token instanceof Token))
            throw new MappingException("Expected a token, got " + token);
        return ((Token) token).getValue();
    }

    static CompiledLexer createLexer() throws InvalidGrammarException {
        Map<String, Object> specs = new LinkedHashMap<String, Object>();
        specs.put("NUMBER", Collections.singletonMap("\\d+(\\.\\d*)?",
            new ValueTransform() {
                public Object transform(String raw) {
                    return Double.valueOf(raw);
                }
            }));
        specs.put("NAME", "[a-z]+");
        specs.put("PLUS", "[+-]");
        specs.put("MUL", "[*/]");
        specs.put("OP", "[()^=]");
        specs.put("WS", "\\s+");
        return LexerCompiler.compile(specs, Arrays.asList("WS"));
    }

    static RuleSet createRules() throws InvalidGrammarException {
        return new RuleSet()
            .rule("start", "expr | assign")
            .rule("assign", "NAME \"=\" expr",
                  RuleSet.named("assign", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return Collections.singletonMap(value(children[0]),
                                                     children[1]);
                }
            }))
            .rule("expr", "expr PLUS term", BINOP)
            .rule("expr", "term")
            .rule("term", "term MUL pow", BINOP)
            .rule("term", "pow")
            .rule("pow", "atom /\\^/ pow", BINOP)
            .rule("pow", "atom")
            .rule("atom", "NUMBER | NAME", new Reducer() {
                public Object reduce(Object... children)
                        throws MappingException {
                    return value(children[0]);
                }
            })
            .rule("atom", "\"(\" expr \")\"");
    }

}
