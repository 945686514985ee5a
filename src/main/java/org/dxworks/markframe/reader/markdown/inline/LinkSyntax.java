package org.dxworks.markframe.reader.markdown.inline;

/**
 * Scanners for link labels, destinations and titles, shared by inline links and link reference
 * definitions. Each scanner returns the index just past what it matched, or {@code -1}.
 */
public final class LinkSyntax {

    private LinkSyntax() {
    }

    /**
     * Scans {@code [label]} starting at the opening bracket. Labels cannot contain unescaped brackets.
     */
    public static int scanLabel(String text, int start) {
        if (start >= text.length() || text.charAt(start) != '[') {
            return -1;
        }
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                i += 2;
                continue;
            }
            if (c == '[') {
                return -1;
            }
            if (c == ']') {
                return i - start - 1 > LinkReferences.MAX_LABEL_LENGTH ? -1 : i + 1;
            }
            i++;
        }
        return -1;
    }

    /**
     * Scans either {@code <...>} without line breaks or a non-empty run without spaces or control
     * characters whose parentheses balance.
     */
    public static int scanDestination(String text, int start) {
        if (start >= text.length()) {
            return -1;
        }
        if (text.charAt(start) == '<') {
            int i = start + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\' && i + 1 < text.length() && InlineText.isAsciiPunctuation(text.charAt(i + 1))) {
                    i += 2;
                } else if (c == '\n' || c == '<') {
                    return -1;
                } else if (c == '>') {
                    return i + 1;
                } else {
                    i++;
                }
            }
            return -1;
        }
        int depth = 0;
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && InlineText.isAsciiPunctuation(text.charAt(i + 1))) {
                i += 2;
                continue;
            }
            if (c <= ' ' || c == '\u007F') {
                break;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            i++;
        }
        if (i == start || depth != 0) {
            return -1;
        }
        return i;
    }

    public static String destination(String text, int start, int end) {
        String raw = text.substring(start, end);
        if (raw.startsWith("<")) {
            raw = raw.substring(1, raw.length() - 1);
        }
        return InlineText.unescape(raw);
    }

    /**
     * Scans a title in double quotes, single quotes or parentheses.
     */
    public static int scanTitle(String text, int start) {
        if (start >= text.length()) {
            return -1;
        }
        char open = text.charAt(start);
        char close = switch (open) {
            case '"', '\'' -> open;
            case '(' -> ')';
            default -> 0;
        };
        if (close == 0) {
            return -1;
        }
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                i += 2;
                continue;
            }
            if (c == close) {
                return i + 1;
            }
            if (open == '(' && c == '(') {
                return -1;
            }
            i++;
        }
        return -1;
    }

    public static String title(String text, int start, int end) {
        return InlineText.unescape(text.substring(start + 1, end - 1));
    }

    /**
     * Skips spaces and tabs.
     */
    public static int skipSpaces(String text, int start) {
        int i = start;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /**
     * Skips spaces and tabs around at most one line ending.
     */
    public static int skipSpacesAndNewline(String text, int start) {
        int i = skipSpaces(text, start);
        if (i < text.length() && text.charAt(i) == '\n') {
            i = skipSpaces(text, i + 1);
        }
        return i;
    }
}
