package org.dxworks.markframe.reader.markdown.inline;

import org.dxworks.markframe.model.inline.Inline;

/**
 * Element of the doubly linked list an inline run is built in: either pending text or a finished
 * inline.
 */
final class InlineNode {

    final StringBuilder text;
    final Inline inline;
    // delimiter runs and brackets keep their own node so they can be shrunk or cut out later
    final boolean fixed;
    InlineNode prev;
    InlineNode next;

    private InlineNode(StringBuilder text, Inline inline, boolean fixed) {
        this.text = text;
        this.inline = inline;
        this.fixed = fixed;
    }

    static InlineNode text(String text, boolean fixed) {
        return new InlineNode(new StringBuilder(text), null, fixed);
    }

    static InlineNode of(Inline inline) {
        return new InlineNode(null, inline, true);
    }

    boolean isText() {
        return inline == null;
    }
}
