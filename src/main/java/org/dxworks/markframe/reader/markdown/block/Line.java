package org.dxworks.markframe.reader.markdown.block;

/**
 * One source line with its leading whitespace measured in columns.
 * <p>
 * Tabs advance to the next multiple of four of the absolute column, so a line keeps the column its
 * first character sits on even after container prefixes have been stripped. The indent itself is
 * virtual: stripping indent only lowers the count and {@link #content()} turns what is left back
 * into spaces.
 */
public final class Line {

    private static final int TAB_STOP = 4;

    private final String text;
    private final int indent;
    private final int column;

    private Line(String text, int indent, int column) {
        this.text = text;
        this.indent = indent;
        this.column = column;
    }

    /**
     * Skips the leading spaces and tabs of {@code raw}, which starts at absolute column {@code column}.
     */
    public static Line scan(String raw, int column) {
        int total = column;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                total++;
            } else if (c == '\t') {
                total += TAB_STOP - total % TAB_STOP;
            } else {
                return new Line(raw.substring(i), total - column, total);
            }
        }
        return new Line("", total - column, total);
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public char first() {
        return text.charAt(0);
    }

    public int indent() {
        return indent;
    }

    public int column() {
        return column;
    }

    /**
     * Text from the first non-blank character to the end of the line.
     */
    public String text() {
        return text;
    }

    /**
     * Re-scans the indent that follows the first character.
     */
    public Line rest() {
        return scan(text.substring(1), column + 1);
    }

    /**
     * Re-scans the indent that follows the first {@code length} characters.
     */
    public Line after(int length) {
        return scan(text.substring(length), column + length);
    }

    public Line withIndent(int columns) {
        return new Line(text, Math.max(0, columns), column);
    }

    public Line withoutIndent(int columns) {
        return new Line(text, Math.max(0, indent - columns), column);
    }

    /**
     * The remaining indent as spaces followed by the text.
     */
    public String content() {
        return " ".repeat(indent) + text;
    }

    @Override
    public String toString() {
        return content();
    }
}
