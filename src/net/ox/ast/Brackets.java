package net.ox.ast;

/**
 * A pair of bracketing tokens put around a child when it is printed.
 * NONE means that the child is printed as-is.
 */
public final class Brackets {

    public static final Brackets NONE = new Brackets(null, null);

    public static final Brackets PARENS = new Brackets("(", ")");

    public static final Brackets SQUARE = new Brackets("[", "]");

    private final String open;
    private final String close;

    private Brackets(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String toString() {
        if (! isWrapping()) return "Brackets.NONE";
        return String.format("Brackets[%s...%s]", open, close);
    }

    public boolean equals(Object other) {
        if (! (other instanceof Brackets)) return false;
        Brackets b = (Brackets) other;
        if (! isWrapping()) return ! b.isWrapping();
        return open.equals(b.open) && close.equals(b.close);
    }

    public int hashCode() {
        return isWrapping() ? open.hashCode() ^ close.hashCode() : 0;
    }

    public boolean isWrapping() {
        return open != null;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public static Brackets of(String open, String close) {
        if (open == null || close == null)
            throw new NullPointerException("Brackets must not be null");
        return new Brackets(open, close);
    }

}
