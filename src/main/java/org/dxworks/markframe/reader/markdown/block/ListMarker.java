package org.dxworks.markframe.reader.markdown.block;

/**
 * A parsed list item marker: {@code - + *} or one to nine digits closed by {@code .} or {@code )}.
 */
final class ListMarker {

    private static final int MAX_DIGITS = 9;
    private static final int MAX_SPACES_AFTER = 4;

    /** Bullet character, or {@code 0} for an ordered marker. */
    final char bullet;
    /** Closing {@code .} or {@code )}, or {@code 0} for a bullet. */
    final char closing;
    final int start;
    final int indent;
    /** Columns from the marker to the item content. */
    final int width;
    /** First line of content, or {@code null} for an item that starts empty. */
    final Line content;

    private ListMarker(char bullet, char closing, int start, int indent, int width, Line content) {
        this.bullet = bullet;
        this.closing = closing;
        this.start = start;
        this.indent = indent;
        this.width = width;
        this.content = content;
    }

    static ListMarker parse(Line line) {
        String text = line.text();
        char c = line.first();
        char bullet = 0;
        char closing = 0;
        int start = 0;
        int markerLength;
        if (c == '-' || c == '+' || c == '*') {
            bullet = c;
            markerLength = 1;
        } else if (c >= '0' && c <= '9') {
            int digits = 0;
            while (digits < text.length() && Character.isDigit(text.charAt(digits)) && text.charAt(digits) < 128) {
                digits++;
            }
            if (digits > MAX_DIGITS || digits == text.length()) {
                return null;
            }
            closing = text.charAt(digits);
            if (closing != '.' && closing != ')') {
                return null;
            }
            start = Integer.parseInt(text.substring(0, digits));
            markerLength = digits + 1;
        } else {
            return null;
        }

        Line after = line.after(markerLength);
        if (after.isBlank()) {
            return new ListMarker(bullet, closing, start, line.indent(), markerLength + 1, null);
        }
        if (after.indent() == 0) {
            return null;
        }
        if (after.indent() <= MAX_SPACES_AFTER) {
            return new ListMarker(bullet, closing, start, line.indent(), markerLength + after.indent(),
                    after.withoutIndent(after.indent()));
        }
        // content indented further is an indented code block one column after the marker
        return new ListMarker(bullet, closing, start, line.indent(), markerLength + 1, after.withoutIndent(1));
    }

    boolean isOrdered() {
        return bullet == 0;
    }

    boolean isEmpty() {
        return content == null;
    }

    boolean sameListAs(ListMarker other) {
        return bullet == other.bullet && closing == other.closing;
    }
}
