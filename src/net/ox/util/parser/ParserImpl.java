package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.ox.api.parser.Grammar;
import net.ox.api.parser.GrammarView;
import net.ox.api.parser.MappingException;
import net.ox.api.parser.MatchingException;
import net.ox.api.parser.Parser;
import net.ox.api.parser.ParsingException;
import net.ox.api.parser.Reducer;
import net.ox.api.parser.TextLocation;
import net.ox.api.parser.TokenSource;
import net.ox.ast.Tree;
import net.ox.util.Formats;

/**
 * The table-driven LALR(1) parser.
 * All per-input state lives on the stack of parse(); instances are
 * immutable.
 */
public class ParserImpl implements Parser {

    private final CompiledGrammarImpl grammar;
    private final Map<String, Reducer> reducers;

    public ParserImpl(CompiledGrammarImpl grammar,
                      Map<String, Reducer> reducers) {
        this.grammar = grammar;
        this.reducers = Collections.unmodifiableMap(
            new HashMap<String, Reducer>(reducers));
    }

    public String toString() {
        return String.format("%s@%h[grammar=%s,reducers=%s]",
            getClass().getName(), this, grammar, reducers.keySet());
    }

    public CompiledGrammarImpl getGrammar() {
        return grammar;
    }

    public Object parse(String input) throws ParsingException {
        return parse(input, grammar.getStartSymbol().getReference());
    }
    public Object parse(String input, String start) throws ParsingException {
        return parse(grammar.createTokenSource(input), start);
    }
    public Object parse(TokenSource source, String start)
            throws ParsingException {
        ParseTable table = grammar.getParseTable();
        ParseTable.State current = table.getStartState(start);
        if (current == null)
            throw new ParsingException(source.getCurrentLocation(),
                                       "Unknown start symbol " + start);
        List<ParseTable.State> states = new ArrayList<ParseTable.State>();
        List<Object> values = new ArrayList<Object>();
        states.add(current);
        source.setSelection(current.getSelection());
        String terminal = null;
        TokenSource.Token token = null;
        for (;;) {
            if (terminal == null) {
                terminal = nextTerminal(source, current);
                token = source.getCurrentToken();
            }
            ParseTable.Action act = current.getAction(terminal);
            if (act == null) throw unexpected(source, token, current);
            switch (act.getType()) {
                case SHIFT:
                    nextToken(source);
                    values.add(token);
                    current = table.getState(act.getTarget());
                    states.add(current);
                    source.setSelection(current.getSelection());
                    terminal = null;
                    token = null;
                    break;
                case REDUCE:
                    ParseTable.Rule rule = table.getRule(act.getTarget());
                    int base = values.size() - rule.getLength();
                    List<Object> args = values.subList(base, values.size());
                    TextLocation pos = (token != null) ?
                        token.getLocation() : source.getCurrentLocation();
                    Object result = reduce(rule, args, pos);
                    args.clear();
                    states.subList(base + 1, states.size()).clear();
                    current = table.getState(states.get(states.size() - 1)
                                                 .getGoto(rule.getName()));
                    states.add(current);
                    values.add(result);
                    break;
                case ACCEPT:
                    Object ret = values.get(values.size() - 1);
                    if (ret instanceof Splice)
                        ret = Tree.of(start, ((Splice) ret).getItems());
                    return ret;
            }
        }
    }

    private String nextTerminal(TokenSource source, ParseTable.State state)
            throws ParsingException {
        for (;;) {
            TokenSource.MatchStatus st;
            try {
                st = source.peek(false);
            } catch (MatchingException exc) {
                throw new ParsingException(exc.getLocation(),
                                           exc.getMessage(), exc);
            }
            if (st == TokenSource.MatchStatus.EOI) return ParseTable.END;
            if (st == TokenSource.MatchStatus.NO_MATCH)
                throw unmatched(source, state);
            TokenSource.Token tok = source.getCurrentToken();
            if (! grammar.getIgnoredTokens().contains(tok.getName()))
                return tok.getName();
            nextToken(source);
        }
    }

    private static void nextToken(TokenSource source)
            throws ParsingException {
        try {
            source.next();
        } catch (MatchingException exc) {
            throw new ParsingException(exc.getLocation(), exc.getMessage(),
                                       exc);
        }
    }

    /* Nothing acceptable matched; tell an out-of-place token apart from
     * garbage. */
    private ParsingException unmatched(TokenSource source,
                                       ParseTable.State state) {
        source.setSelection(grammar.getFullSelection());
        try {
            source.peek(true);
        } catch (MatchingException exc) {
            return new ParsingException(exc.getLocation(), exc.getMessage(),
                                        exc);
        }
        return unexpected(source, source.getCurrentToken(), state);
    }

    private static ParsingException unexpected(TokenSource source,
            TokenSource.Token token, ParseTable.State state) {
        String expected = "expected one of: " + state.getExpected();
        if (token == null) {
            TextLocation pos = source.getCurrentLocation();
            return new ParsingException(pos, "Unexpected end of input at " +
                pos + ", " + expected);
        }
        return new ParsingException(token.getLocation(), "Unexpected token " +
            token.getName() + " " + Formats.formatString(token.getContent()) +
            " at " + token.getLocation() + ", " + expected);
    }

    private Object reduce(ParseTable.Rule rule, List<Object> args,
                          TextLocation pos) throws ParsingException {
        boolean keepAll = ((rule.getRuleFlags() &
                            GrammarView.RULE_KEEP_ALL) != 0);
        List<Object> items = new ArrayList<Object>(args.size());
        for (int i = 0; i < args.size(); i++) {
            int flags = rule.getSymbolFlags(i);
            Object value = args.get(i);
            if ((flags & Grammar.Symbol.SYM_DISCARD) != 0 && ! keepAll)
                continue;
            if (value instanceof Splice) {
                items.addAll(((Splice) value).getItems());
            } else if ((flags & Grammar.Symbol.SYM_INLINE) != 0 &&
                       value instanceof Tree) {
                items.addAll(((Tree) value).release());
            } else {
                items.add(value);
            }
        }
        String key = (rule.getAlias() != null) ? rule.getAlias() :
            rule.getName();
        Reducer red = reducers.get(key);
        if (red != null) {
            try {
                return red.reduce(items.toArray());
            } catch (MappingException exc) {
                throw reducerFailure(key, pos, exc);
            } catch (RuntimeException exc) {
                throw reducerFailure(key, pos, exc);
            }
        }
        if (rule.getAlias() != null) return Tree.of(rule.getAlias(), items);
        if ((rule.getRuleFlags() & GrammarView.RULE_SPLICE) != 0)
            return new Splice(items);
        if ((rule.getRuleFlags() & GrammarView.RULE_INLINE_SINGLE) != 0 &&
                items.size() == 1)
            return items.get(0);
        return Tree.of(rule.getName(), items);
    }

    private static ParsingException reducerFailure(String key,
            TextLocation pos, Exception exc) {
        return new ParsingException(pos, "Reducer for " + key +
            " failed at " + pos + ": " + exc.getMessage(), exc);
    }

}
