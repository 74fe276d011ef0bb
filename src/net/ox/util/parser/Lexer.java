package net.ox.util.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import net.ox.api.parser.MatchingException;
import net.ox.api.parser.TextLocation;
import net.ox.api.parser.TokenSource;
import net.ox.util.Formats;
import net.ox.util.Locations;
import net.ox.util.NamedMap;
import net.ox.util.config.Configuration;
import net.ox.util.config.Settings;

public class Lexer implements TokenSource {

    public static final String TAB_SIZE_KEY = "ox.lexer.tabSize";

    public static class StandardSelection implements Selection {

        private final Map<String, TokenPattern> patterns;

        public StandardSelection(Map<String, TokenPattern> patterns) {
            this.patterns = Collections.unmodifiableMap(
                new NamedMap<TokenPattern>(
                    new LinkedHashMap<String, TokenPattern>(patterns)));
        }
        public StandardSelection() {
            this(Collections.<String, TokenPattern>emptyMap());
        }

        public String toString() {
            return String.format("%s@%h[patterns=%s]",
                getClass().getName(), this, patterns.keySet());
        }

        public Map<String, TokenPattern> getPatterns() {
            return patterns;
        }

        public boolean isCompatibleWith(Selection other) {
            return other.getPatterns().keySet().containsAll(
                getPatterns().keySet());
        }

        public boolean contains(Token tok) {
            return getPatterns().containsKey(tok.getName());
        }

    }

    private final String input;
    private final Locations.LocationTracker inputPosition;
    private final Map<String, Matcher> matchers;
    private int offset;
    private Selection selection;
    private MatchStatus matchStatus;
    private Token currentToken;
    private int currentEnd;

    public Lexer(String input, int tabSize) {
        if (input == null)
            throw new NullPointerException("Lexer input may not be null");
        this.input = input;
        this.inputPosition = new Locations.LocationTracker(tabSize);
        this.matchers = new HashMap<String, Matcher>();
    }
    public Lexer(String input, Configuration config) {
        this(input, Settings.getInt(config, TAB_SIZE_KEY,
            Locations.LocationTracker.DEFAULT_TAB_SIZE));
    }
    public Lexer(String input) {
        this(input, Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[position=%s]", getClass().getName(),
                             this, getCurrentLocation());
    }

    protected String getInput() {
        return input;
    }

    public TextLocation getCurrentLocation() {
        return inputPosition.freeze();
    }

    protected Selection getSelection() {
        return selection;
    }
    public void setSelection(Selection s) {
        if (s == selection) return;
        Selection os = selection;
        selection = s;
        if (matchStatus != null && (s == null || os == null ||
                (matchStatus == MatchStatus.OK && ! s.contains(currentToken)) ||
                ! s.isCompatibleWith(os))) {
            matchStatus = null;
            currentToken = null;
        }
    }

    public Token getCurrentToken() {
        return currentToken;
    }

    protected Matcher getMatcher(TokenPattern pat) {
        Matcher m = matchers.get(pat.getName());
        if (m == null) {
            m = pat.getSymbol().getPattern().matcher(input);
            m.useAnchoringBounds(false);
            m.useTransparentBounds(true);
            matchers.put(pat.getName(), m);
        }
        m.region(offset, input.length());
        return m;
    }

    /* Among all patterns of the selection matching at the current
     * position, pick the one with the highest priority, then the longest
     * match, then the highest match rank, then the first declared. */
    protected MatchStatus doMatch() throws MatchingException {
        if (offset == input.length()) return MatchStatus.EOI;
        if (selection == null) return MatchStatus.NO_MATCH;
        TokenPattern best = null;
        int bestEnd = -1;
        for (TokenPattern pat : selection.getPatterns().values()) {
            Matcher m = getMatcher(pat);
            if (! m.lookingAt() || m.end() == offset) continue;
            if (best != null) {
                if (pat.getPriority() != best.getPriority()) {
                    if (pat.getPriority() < best.getPriority()) continue;
                } else if (m.end() != bestEnd) {
                    if (m.end() < bestEnd) continue;
                } else if (pat.getSymbol().getMatchRank() <=
                           best.getSymbol().getMatchRank()) {
                    continue;
                }
            }
            best = pat;
            bestEnd = m.end();
        }
        if (best == null) return MatchStatus.NO_MATCH;
        Locations.LocationTracker end =
            new Locations.LocationTracker(inputPosition);
        end.advance(input, offset, bestEnd - offset);
        currentToken = best.createToken(inputPosition.freeze(), end.freeze(),
                                        input.substring(offset, bestEnd));
        currentEnd = bestEnd;
        return MatchStatus.OK;
    }

    protected MatchingException unexpectedInput() {
        TextLocation pos = getCurrentLocation();
        String message = (offset == input.length()) ?
            "Unexpected end of input" :
            "Unexpected character " + Formats.formatCharacter(
                input.codePointAt(offset));
        return new MatchingException(pos, message + " at " + pos);
    }

    protected MatchStatus peek() throws MatchingException {
        if (matchStatus != null) return matchStatus;
        MatchStatus st = doMatch();
        matchStatus = st;
        if (st != MatchStatus.OK) currentToken = null;
        return st;
    }
    public MatchStatus peek(boolean required) throws MatchingException {
        MatchStatus ret = peek();
        if (required && ret == MatchStatus.NO_MATCH)
            throw unexpectedInput();
        return ret;
    }

    public Token next() throws MatchingException {
        MatchStatus st = peek();
        Token tok = currentToken;
        switch (st) {
            case NO_MATCH:
                throw unexpectedInput();
            case EOI:
                throw new MatchingException(getCurrentLocation(),
                                            "No more input to advance past");
        }
        inputPosition.advance(input, offset, currentEnd - offset);
        offset = currentEnd;
        matchStatus = null;
        currentToken = null;
        return tok;
    }

    /**
     * Split the remaining input into tokens using the current selection,
     * dropping the tokens whose names are in ignored.
     */
    public List<Token> lex(Set<String> ignored) throws MatchingException {
        List<Token> ret = new ArrayList<Token>();
        while (peek(true) == MatchStatus.OK) {
            Token tok = next();
            if (! ignored.contains(tok.getName())) ret.add(tok);
        }
        return ret;
    }

}
