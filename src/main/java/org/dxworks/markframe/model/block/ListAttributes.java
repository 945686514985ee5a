package org.dxworks.markframe.model.block;

import java.util.Objects;

/**
 * Numbering of an {@link OrderedList}: first number, number style and delimiter.
 */
public class ListAttributes {
    public int start = 1;
    public NumberStyle style = NumberStyle.DEFAULT_STYLE;
    public NumberDelimiter delimiter = NumberDelimiter.DEFAULT_DELIMITER;

    public enum NumberStyle {
        DEFAULT_STYLE,
        EXAMPLE,
        DECIMAL,
        LOWER_ROMAN,
        UPPER_ROMAN,
        LOWER_ALPHA,
        UPPER_ALPHA
    }

    public enum NumberDelimiter {
        DEFAULT_DELIMITER,
        PERIOD,
        ONE_PAREN,
        TWO_PARENS
    }

    public ListAttributes() {
    }

    public ListAttributes(int start, NumberStyle style, NumberDelimiter delimiter) {
        this.start = start;
        this.style = style;
        this.delimiter = delimiter;
    }

    /**
     * Decimal numbering closed by {@code '.'} or {@code ')'}.
     */
    public static ListAttributes decimal(int start, char closing) {
        NumberDelimiter delimiter = switch (closing) {
            case '.' -> NumberDelimiter.PERIOD;
            case ')' -> NumberDelimiter.ONE_PAREN;
            default -> throw new IllegalArgumentException("Not an ordered list delimiter: " + closing);
        };
        return new ListAttributes(start, NumberStyle.DECIMAL, delimiter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListAttributes other)) return false;
        return start == other.start && style == other.style && delimiter == other.delimiter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, style, delimiter);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + style + ", " + delimiter + ")";
    }
}
