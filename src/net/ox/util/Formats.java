package net.ox.util;

import java.util.regex.Pattern;

public final class Formats {

    public static final String ESCAPE_SEQUENCE =
        "\\\\(?:u[0-9a-fA-F]{4}|x[0-9a-fA-F]{2}|[^ux])";

    private static final String REGEX_FLAG_CHARS = "imsux";
    private static final int[] REGEX_FLAG_VALUES = {
        Pattern.CASE_INSENSITIVE, Pattern.MULTILINE, Pattern.DOTALL,
        Pattern.UNICODE_CASE, Pattern.COMMENTS
    };

    private Formats() {}

    private static void appendEscaped(StringBuilder sb, char ch,
                                      char quote) {
        switch (ch) {
            case '\n': sb.append("\\n"); break;
            case '\r': sb.append("\\r"); break;
            case '\t': sb.append("\\t"); break;
            case '\\': sb.append("\\\\"); break;
            default:
                if (ch == quote) {
                    sb.append('\\').append(ch);
                } else if (ch < 0x20 || ch == 0x7f) {
                    sb.append(String.format("\\x%02x", (int) ch));
                } else {
                    sb.append(ch);
                }
        }
    }

    public static String formatString(String s, char quote) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append(quote);
        for (int i = 0; i < s.length(); i++) {
            appendEscaped(sb, s.charAt(i), quote);
        }
        return sb.append(quote).toString();
    }
    public static String formatString(String s) {
        return formatString(s, '"');
    }

    public static String formatCharacter(int codepoint) {
        if (codepoint < 0x20 || codepoint == 0x7f ||
                Character.isSupplementaryCodePoint(codepoint))
            return String.format("U+%04X", codepoint);
        StringBuilder sb = new StringBuilder("'");
        appendEscaped(sb, (char) codepoint, '\'');
        return sb.append('\'').toString();
    }

    public static String formatPattern(Pattern pat) {
        StringBuilder sb = new StringBuilder("/");
        sb.append(escapeSlashes(pat.pattern())).append('/');
        for (int i = 0; i < REGEX_FLAG_VALUES.length; i++) {
            if ((pat.flags() & REGEX_FLAG_VALUES[i]) != 0)
                sb.append(REGEX_FLAG_CHARS.charAt(i));
        }
        return sb.toString();
    }

    public static int parsePatternFlags(String flags) {
        int ret = 0;
        for (int i = 0; i < flags.length(); i++) {
            int idx = REGEX_FLAG_CHARS.indexOf(flags.charAt(i));
            if (idx == -1)
                throw new IllegalArgumentException("Invalid regex flag " +
                    formatCharacter(flags.charAt(i)));
            ret |= REGEX_FLAG_VALUES[idx];
        }
        return ret;
    }

    /* Escape slashes that are not escaped already, for embedding into
     * /.../ literals. */
    public static String escapeSlashes(String regex) {
        StringBuilder sb = new StringBuilder(regex.length());
        boolean escaped = false;
        for (int i = 0; i < regex.length(); i++) {
            char ch = regex.charAt(i);
            if (ch == '/' && ! escaped) sb.append('\\');
            sb.append(ch);
            escaped = (ch == '\\' && ! escaped);
        }
        return sb.toString();
    }

    public static String unescapeSlashes(String regex) {
        StringBuilder sb = new StringBuilder(regex.length());
        for (int i = 0; i < regex.length(); i++) {
            char ch = regex.charAt(i);
            if (ch == '\\' && i + 1 < regex.length()) {
                char next = regex.charAt(++i);
                if (next != '/') sb.append(ch);
                sb.append(next);
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    public static String parseEscapeSequence(String seq) {
        if (seq.length() < 2 || seq.charAt(0) != '\\')
            throw new IllegalArgumentException("Invalid escape sequence " +
                formatString(seq));
        char kind = seq.charAt(1);
        switch (kind) {
            case 'n': return "\n";
            case 'r': return "\r";
            case 't': return "\t";
            case 'f': return "\f";
            case 'b': return "\b";
            case '0': return "\0";
            case 'u': case 'x':
                int expected = (kind == 'u') ? 6 : 4;
                if (seq.length() != expected)
                    throw new IllegalArgumentException(
                        "Truncated escape sequence " + formatString(seq));
                try {
                    return String.valueOf((char) Integer.parseInt(
                        seq.substring(2), 16));
                } catch (NumberFormatException exc) {
                    throw new IllegalArgumentException(
                        "Invalid escape sequence " + formatString(seq), exc);
                }
            default:
                if (seq.length() != 2)
                    throw new IllegalArgumentException(
                        "Invalid escape sequence " + formatString(seq));
                return String.valueOf(kind);
        }
    }

    /* Strip the quotes from a string literal and resolve its escape
     * sequences. */
    public static String parseStringLiteral(String literal) {
        if (literal.length() < 2 ||
                literal.charAt(literal.length() - 1) != literal.charAt(0))
            throw new IllegalArgumentException("Malformed string literal " +
                literal);
        StringBuilder sb = new StringBuilder(literal.length());
        int end = literal.length() - 1;
        for (int i = 1; i < end; i++) {
            char ch = literal.charAt(i);
            if (ch != '\\') {
                sb.append(ch);
                continue;
            }
            if (i + 1 >= end)
                throw new IllegalArgumentException(
                    "Dangling backslash in string literal " + literal);
            char kind = literal.charAt(i + 1);
            int len = (kind == 'u') ? 6 : (kind == 'x') ? 4 : 2;
            if (i + len > end)
                throw new IllegalArgumentException(
                    "Truncated escape sequence in string literal " +
                    literal);
            sb.append(parseEscapeSequence(literal.substring(i, i + len)));
            i += len - 1;
        }
        return sb.toString();
    }

    public static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder(s.length() * count);
        for (int i = 0; i < count; i++) sb.append(s);
        return sb.toString();
    }

}
