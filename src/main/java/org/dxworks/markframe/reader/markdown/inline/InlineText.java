package org.dxworks.markframe.reader.markdown.inline;

/**
 * Character classes used by the inline rules, and backslash/entity unescaping for link
 * destinations, titles and code info strings.
 */
public final class InlineText {

    private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private InlineText() {
    }

    public static boolean isAsciiPunctuation(char c) {
        return ASCII_PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * ASCII punctuation or any Unicode punctuation or symbol code point.
     */
    public static boolean isPunctuation(int codePoint) {
        if (codePoint < 128) {
            return isAsciiPunctuation((char) codePoint);
        }
        switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
                return true;
            default:
                return false;
        }
    }

    public static boolean isWhitespace(int codePoint) {
        return codePoint == ' ' || codePoint == '\t' || codePoint == '\n' || codePoint == '\u000B'
                || codePoint == '\f' || codePoint == '\r'
                || Character.getType(codePoint) == Character.SPACE_SEPARATOR;
    }

    /**
     * Resolves backslash escapes of ASCII punctuation and character references.
     */
    public static String unescape(String text) {
        if (text.indexOf('\\') < 0 && text.indexOf('&') < 0) {
            return text;
        }
        StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && isAsciiPunctuation(text.charAt(i + 1))) {
                result.append(text.charAt(i + 1));
                i += 2;
            } else if (c == '&') {
                EntityDecoder.Match match = EntityDecoder.match(text, i);
                if (match != null) {
                    result.append(match.value);
                    i = match.end;
                } else {
                    result.append(c);
                    i++;
                }
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }
}
