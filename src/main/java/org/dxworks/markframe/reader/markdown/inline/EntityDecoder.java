package org.dxworks.markframe.reader.markdown.inline;

import org.jsoup.nodes.Entities;

/**
 * Decodes HTML character references: {@code &#123;}, {@code &#x7B;} and named references such as
 * {@code &amp;}. Names are looked up in jsoup's HTML5 entity table.
 */
final class EntityDecoder {

    private static final int MAX_DECIMAL_DIGITS = 7;
    private static final int MAX_HEX_DIGITS = 6;
    private static final int MAX_NAME_LENGTH = 32;
    private static final String REPLACEMENT = "\uFFFD";

    static final class Match {
        final String value;
        /** Index just past the terminating {@code ;}. */
        final int end;

        Match(String value, int end) {
            this.value = value;
            this.end = end;
        }
    }

    private EntityDecoder() {
    }

    /**
     * Matches a reference starting at the {@code &} at {@code start}, or returns {@code null} when the
     * text there is not a well-formed reference.
     */
    static Match match(String text, int start) {
        int i = start + 1;
        if (i < text.length() && text.charAt(i) == '#') {
            return matchNumeric(text, i + 1);
        }
        int nameStart = i;
        while (i < text.length() && i - nameStart <= MAX_NAME_LENGTH && isAsciiAlphanumeric(text.charAt(i))) {
            i++;
        }
        if (i == nameStart || i >= text.length() || text.charAt(i) != ';') {
            return null;
        }
        String name = text.substring(nameStart, i);
        if (!Character.isLetter(name.charAt(0)) || !Entities.isNamedEntity(name)) {
            return null;
        }
        return new Match(Entities.getByName(name), i + 1);
    }

    private static Match matchNumeric(String text, int start) {
        int i = start;
        boolean hex = i < text.length() && (text.charAt(i) == 'x' || text.charAt(i) == 'X');
        if (hex) {
            i++;
        }
        int digitsStart = i;
        int maxDigits = hex ? MAX_HEX_DIGITS : MAX_DECIMAL_DIGITS;
        while (i < text.length() && i - digitsStart <= maxDigits && isDigit(text.charAt(i), hex)) {
            i++;
        }
        int digits = i - digitsStart;
        if (digits == 0 || digits > maxDigits || i >= text.length() || text.charAt(i) != ';') {
            return null;
        }
        int codePoint = Integer.parseInt(text.substring(digitsStart, i), hex ? 16 : 10);
        return new Match(fromCodePoint(codePoint), i + 1);
    }

    static String fromCodePoint(int codePoint) {
        if (codePoint == 0 || codePoint > Character.MAX_CODE_POINT
                || codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
            return REPLACEMENT;
        }
        return new String(Character.toChars(codePoint));
    }

    private static boolean isDigit(char c, boolean hex) {
        if (c >= '0' && c <= '9') {
            return true;
        }
        return hex && (c >= 'a' && c <= 'f' || c >= 'A' && c <= 'F');
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9';
    }
}
