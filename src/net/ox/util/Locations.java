package net.ox.util;

import net.ox.api.parser.TextLocation;

public final class Locations {

    public static class FixedLocation implements TextLocation {

        private final long line;
        private final long column;
        private final long characterIndex;

        public FixedLocation(long line, long column, long characterIndex) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
        }
        public FixedLocation(TextLocation other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex());
        }

        public String toString() {
            return String.format("line %d column %d", getLine(),
                                 getColumn());
        }

        public boolean equals(Object other) {
            if (! (other instanceof FixedLocation)) return false;
            TextLocation co = (TextLocation) other;
            return (line == co.getLine() &&
                    column == co.getColumn() &&
                    characterIndex == co.getCharacterIndex());
        }

        public int hashCode() {
            return (int) (line ^ line >>> 31 ^ column ^ column >>> 31 ^
                characterIndex ^ characterIndex >>> 31);
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

    }

    public static class LocationTracker implements TextLocation {

        public static final int DEFAULT_TAB_SIZE = 8;

        private long line;
        private long column;
        private long characterIndex;
        private boolean inCR;
        private int tabSize;

        public LocationTracker(long line, long column, long characterIndex,
                               int tabSize) {
            this.line = line;
            this.column = column;
            this.characterIndex = characterIndex;
            this.inCR = false;
            this.tabSize = tabSize;
        }
        public LocationTracker(int tabSize) {
            this(1, 1, 0, tabSize);
        }
        public LocationTracker(LocationTracker other) {
            this(other.getLine(), other.getColumn(),
                 other.getCharacterIndex(), other.getTabSize());
            inCR = other.inCR;
        }
        public LocationTracker() {
            this(DEFAULT_TAB_SIZE);
        }

        public String toString() {
            return String.format("%s@%h[line=%s,column=%s,char=%s," +
                "tabSize=%s]", getClass().getName(), this, getLine(),
                getColumn(), getCharacterIndex(), getTabSize());
        }

        public long getLine() {
            return line;
        }

        public long getColumn() {
            return column;
        }

        public long getCharacterIndex() {
            return characterIndex;
        }

        public int getTabSize() {
            return tabSize;
        }

        public FixedLocation freeze() {
            return new FixedLocation(this);
        }

        public void advance(char ch) {
            characterIndex++;
            switch (ch) {
                case '\t':
                    column = (column + tabSize - 1) / tabSize * tabSize + 1;
                    break;
                case '\n':
                    // The LF of a CRLF pair does not start another line.
                    if (inCR) break;
                    line++;
                    column = 1;
                    break;
                case '\r':
                    line++;
                    column = 1;
                    break;
                default:
                    column++;
                    break;
            }
            inCR = (ch == '\r');
        }
        public void advance(CharSequence data, int offset, int size) {
            for (int i = offset, ei = offset + size; i < ei; i++) {
                advance(data.charAt(i));
            }
        }

    }

    private Locations() {}

}
