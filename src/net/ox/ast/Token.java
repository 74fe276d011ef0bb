package net.ox.ast;

import java.util.List;
import net.ox.api.parser.TextLocation;
import net.ox.api.parser.TokenSource;

/**
 * A lexical token as an AST leaf.
 * A Token holds a semantic value, a token type (the name of the token
 * definition that produced it), the source span it covers, and the raw
 * string it was produced from. Tokens are immutable; two tokens are equal
 * if their values and types are, regardless of their positions.
 */
public class Token extends Leaf implements TokenSource.Token {

    /** The token type of tokens created without one. */
    public static final String DEFAULT_TYPE = "TOKEN";

    /** The token type of boxed non-AST values inside trees. */
    public static final String VALUE_TYPE = "VALUE";

    public static final AstType TYPE = AstType.leaf("Token", Token.class,
                                                    Syntax.ROOT, Object.class)
        .factory(new AstType.Factory() {
            public Ast create(Object[] args) {
                return new Token(args[0]);
            }
        })
        .build();

    private final String tokenType;
    private final TextLocation start;
    private final TextLocation end;
    private final String string;

    public Token(Object value, String type, TextLocation start,
                 TextLocation end, String string) {
        super(TYPE, value);
        if (type == null)
            throw new ConstructionException("Token type must not be null");
        this.tokenType = type;
        this.start = start;
        this.end = end;
        this.string = string;
    }
    public Token(Object value, String type) {
        this(value, type, null, null, null);
    }
    public Token(Object value) {
        this(value, DEFAULT_TYPE);
    }

    public String toString() {
        return "Token(" + tokenType + ", " + formatValue(getValue()) + ")";
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (! (other instanceof Token)) return false;
        Token t = (Token) other;
        return tokenType.equals(t.tokenType) && super.equals(other);
    }

    public int hashCode() {
        return tokenType.hashCode() ^ super.hashCode();
    }

    /**
     * The token type.
     */
    public String getName() {
        return tokenType;
    }

    public String getTokenType() {
        return tokenType;
    }

    public TokenSource.Token getToken() {
        return this;
    }

    /**
     * The location of the first character, or null if unknown.
     */
    public TextLocation getLocation() {
        return start;
    }

    /**
     * The location just past the last character, or null if unknown.
     */
    public TextLocation getEndLocation() {
        return end;
    }

    /**
     * The raw string this token was produced from, or null.
     */
    public String getString() {
        return string;
    }

    /**
     * The raw string, or the string form of the value if there is none.
     */
    public String getContent() {
        return (string != null) ? string : String.valueOf(getValue());
    }

    public Ast copy() {
        return withAttributesOf(new Token(getValue(), tokenType, start, end,
                                          string));
    }

    protected void printTo(PrintContext ctx, List<String> out) {
        out.add(getContent());
    }

}
