package net.ox.util.parser;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import net.ox.api.NamedValue;
import net.ox.api.parser.InvalidGrammarException;
import net.ox.api.parser.ValueTransform;

/**
 * A single token declaration of a declarative lexer.
 */
public class LexRule implements NamedValue {

    private final String name;
    private final String pattern;
    private final ValueTransform transform;
    private final Integer priority;
    private final boolean ignore;

    public LexRule(String name, String pattern, ValueTransform transform,
                   Integer priority, boolean ignore) {
        if (pattern == null)
            throw new NullPointerException("Lex rule pattern may not be null");
        this.name = name;
        this.pattern = pattern;
        this.transform = transform;
        this.priority = priority;
        this.ignore = ignore;
    }
    public LexRule(String pattern, ValueTransform transform) {
        this(null, pattern, transform, null, false);
    }
    public LexRule(String pattern) {
        this(null, pattern, null, null, false);
    }

    public String toString() {
        return String.format("%s@%h[name=%s,pattern=%s,priority=%s," +
            "ignore=%s]", getClass().getName(), this, name, pattern,
            priority, ignore);
    }

    /**
     * The name of the token; null if the rule has not been named yet.
     */
    public String getName() {
        return name;
    }

    /**
     * The regular expression (in java.util.regex syntax).
     */
    public String getPattern() {
        return pattern;
    }

    public ValueTransform getTransform() {
        return transform;
    }

    /**
     * The explicit priority, or null.
     */
    public Integer getPriority() {
        return priority;
    }

    public int getEffectivePriority() {
        return (priority == null) ? 0 : priority;
    }

    public boolean isIgnored() {
        return ignore;
    }

    public LexRule withName(String newName) {
        return new LexRule(newName, pattern, transform, priority, ignore);
    }

    public LexRule withPriority(Integer newPriority) {
        return new LexRule(name, pattern, transform, newPriority, ignore);
    }

    public LexRule withIgnore(boolean newIgnore) {
        return new LexRule(name, pattern, transform, priority, newIgnore);
    }

    /**
     * Check the rule and compile its pattern.
     */
    public Pattern compilePattern() throws InvalidGrammarException {
        if (name == null)
            throw new InvalidGrammarException("Lex rule " + pattern +
                                              " has no name");
        if (! GrammarImpl.TOKEN_NAME_PATTERN.matcher(name).matches() ||
                name.startsWith("_"))
            throw new InvalidGrammarException("Invalid token name " + name);
        Pattern ret;
        try {
            ret = Pattern.compile(pattern);
        } catch (PatternSyntaxException exc) {
            throw new InvalidGrammarException("Invalid pattern for token " +
                name + ": " + exc.getDescription(), exc);
        }
        if (ret.matcher("").matches())
            throw new InvalidGrammarException("Pattern of token " + name +
                " matches the empty string");
        return ret;
    }

}
