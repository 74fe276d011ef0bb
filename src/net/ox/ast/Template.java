package net.ox.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A fixed textual pattern with named placeholders, such as
 * "{lhs} {op} {rhs}".
 * Placeholders are filled in by rendering the named field of a node; "{{"
 * and "}}" stand for literal braces.
 */
public final class Template {

    /**
     * A piece of a template: either literal text or a placeholder.
     */
    public static final class Part {

        private final String text;
        private final boolean placeholder;

        private Part(String text, boolean placeholder) {
            this.text = text;
            this.placeholder = placeholder;
        }

        public String toString() {
            return (placeholder) ? "{" + text + "}" : text;
        }

        /**
         * The literal text or the name of the placeholder's field.
         */
        public String getText() {
            return text;
        }

        public boolean isPlaceholder() {
            return placeholder;
        }

    }

    private final String source;
    private final List<Part> parts;
    private final Set<String> fieldNames;

    private Template(String source, List<Part> parts) {
        Set<String> names = new LinkedHashSet<String>();
        for (Part p : parts) {
            if (p.isPlaceholder()) names.add(p.getText());
        }
        this.source = source;
        this.parts = Collections.unmodifiableList(parts);
        this.fieldNames = Collections.unmodifiableSet(names);
    }

    public String toString() {
        return source;
    }

    public String getSource() {
        return source;
    }

    public List<Part> getParts() {
        return parts;
    }

    /**
     * The names of all placeholders, in order of first occurrence.
     */
    public Set<String> getFieldNames() {
        return fieldNames;
    }

    public static Template parse(String source) {
        List<Part> parts = new ArrayList<Part>();
        StringBuilder literal = new StringBuilder();
        int i = 0, len = source.length();
        while (i < len) {
            char ch = source.charAt(i);
            if (ch == '{' && i + 1 < len && source.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (ch == '}' && i + 1 < len &&
                       source.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (ch == '{') {
                int end = source.indexOf('}', i);
                if (end == -1)
                    throw new DeclarationException("Unterminated " +
                        "placeholder in template \"" + source + "\"");
                String name = source.substring(i + 1, end).trim();
                if (name.isEmpty())
                    throw new DeclarationException("Empty placeholder in " +
                        "template \"" + source + "\"");
                if (literal.length() != 0) {
                    parts.add(new Part(literal.toString(), false));
                    literal.setLength(0);
                }
                parts.add(new Part(name, true));
                i = end + 1;
            } else if (ch == '}') {
                throw new DeclarationException("Unbalanced \"}\" in " +
                    "template \"" + source + "\"");
            } else {
                literal.append(ch);
                i++;
            }
        }
        if (literal.length() != 0)
            parts.add(new Part(literal.toString(), false));
        return new Template(source, parts);
    }

}
