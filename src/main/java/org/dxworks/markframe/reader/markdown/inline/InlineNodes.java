package org.dxworks.markframe.reader.markdown.inline;

import org.dxworks.markframe.model.inline.Inline;
import org.dxworks.markframe.model.inline.Space;
import org.dxworks.markframe.model.inline.Str;

import java.util.ArrayList;
import java.util.List;

final class InlineNodes {

    private InlineNode head;
    private InlineNode tail;

    InlineNode first() {
        return head;
    }

    InlineNode last() {
        return tail;
    }

    /**
     * Appends text, extending the last node when it is plain text as well.
     */
    InlineNode appendText(String text, boolean fixed) {
        if (!fixed && tail != null && tail.isText() && !tail.fixed) {
            tail.text.append(text);
            return tail;
        }
        return append(InlineNode.text(text, fixed));
    }

    InlineNode appendInline(Inline inline) {
        return append(InlineNode.of(inline));
    }

    private InlineNode append(InlineNode node) {
        node.prev = tail;
        if (tail == null) {
            head = node;
        } else {
            tail.next = node;
        }
        tail = node;
        return node;
    }

    /**
     * Removes trailing spaces and tabs of the last text node.
     *
     * @return the number of trailing spaces removed
     */
    int trimTrailingWhitespace() {
        if (tail == null || !tail.isText()) {
            return 0;
        }
        StringBuilder text = tail.text;
        int spaces = 0;
        while (text.length() > 0) {
            char c = text.charAt(text.length() - 1);
            if (c == ' ') {
                spaces++;
            } else if (c != '\t') {
                break;
            }
            text.setLength(text.length() - 1);
        }
        return spaces;
    }

    void remove(InlineNode node) {
        if (node.prev == null) {
            head = node.next;
        } else {
            node.prev.next = node.next;
        }
        if (node.next == null) {
            tail = node.prev;
        } else {
            node.next.prev = node.prev;
        }
        node.prev = null;
        node.next = null;
    }

    /**
     * Cuts {@code node} and everything after it off the list.
     */
    void truncateAt(InlineNode node) {
        tail = node.prev;
        if (tail == null) {
            head = null;
        } else {
            tail.next = null;
        }
        node.prev = null;
    }

    /**
     * Replaces the nodes strictly between {@code after} and {@code before} with one inline.
     */
    void replaceBetween(InlineNode after, InlineNode before, Inline inline) {
        InlineNode node = InlineNode.of(inline);
        node.prev = after;
        node.next = before;
        after.next = node;
        before.prev = node;
    }

    /**
     * Converts the nodes from {@code from} up to, not including, {@code until} into inlines. Adjacent
     * text is merged and split into words and spaces.
     */
    static List<Inline> flatten(InlineNode from, InlineNode until) {
        List<Inline> result = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (InlineNode node = from; node != null && node != until; node = node.next) {
            if (node.isText()) {
                pending.append(node.text);
            } else {
                splitWords(pending, result);
                result.add(node.inline);
            }
        }
        splitWords(pending, result);
        return result;
    }

    private static void splitWords(StringBuilder text, List<Inline> result) {
        int i = 0;
        while (i < text.length()) {
            int start = i;
            if (isSpace(text.charAt(i))) {
                while (i < text.length() && isSpace(text.charAt(i))) {
                    i++;
                }
                result.add(new Space());
            } else {
                while (i < text.length() && !isSpace(text.charAt(i))) {
                    i++;
                }
                result.add(new Str(text.substring(start, i)));
            }
        }
        text.setLength(0);
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t';
    }
}
