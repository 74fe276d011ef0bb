package net.ox.ast;

import net.ox.util.Formats;
import net.ox.util.config.Configuration;
import net.ox.util.config.Settings;

/**
 * Mutable state threaded through a pretty-printing pass.
 * Currently, this is the indentation level; block-structured nodes raise it
 * while printing their bodies and prefix each line with startLine().
 * A PrintContext is not safe for concurrent use; getSource() creates a
 * fresh one per call.
 */
public class PrintContext {

    public static final String INDENT_KEY = "ox.print.indent";

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final String indentUnit;
    private int level;

    public PrintContext(int indentWidth) {
        if (indentWidth < 0)
            throw new IllegalArgumentException(
                "Indentation width must not be negative");
        this.indentUnit = Formats.repeat(" ", indentWidth);
    }
    public PrintContext(Configuration config) {
        this(Settings.getInt(config, INDENT_KEY, DEFAULT_INDENT_WIDTH));
    }
    public PrintContext() {
        this(Configuration.DEFAULT);
    }

    public String toString() {
        return String.format("%s@%h[level=%s,width=%s]",
            getClass().getName(), this, level, indentUnit.length());
    }

    /**
     * The current indentation level (zero at the outermost level).
     */
    public int getLevel() {
        return level;
    }

    public int getIndentWidth() {
        return indentUnit.length();
    }

    public void indent(int n) {
        if (n < 0)
            throw new IllegalArgumentException(
                "Cannot indent by a negative amount");
        level += n;
    }
    public void indent() {
        indent(1);
    }

    public void dedent(int n) {
        if (n < 0)
            throw new IllegalArgumentException(
                "Cannot dedent by a negative amount");
        if (n > level)
            throw new IllegalStateException("Cannot dedent by " + n +
                " at indentation level " + level);
        level -= n;
    }
    public void dedent() {
        dedent(1);
    }

    /**
     * The whitespace that starts a line at the current indentation level.
     */
    public String startLine() {
        return Formats.repeat(indentUnit, level);
    }

}
