package org.dxworks.markframe.reader.markdown.inline;

/**
 * An opening {@code [} or {@code ![} waiting for its {@code ]}.
 */
final class Bracket {

    final InlineNode node;
    final boolean image;
    /** Index of the first character of the link text. */
    final int textStart;
    /** Top of the delimiter stack when the bracket was opened. */
    final Delimiter previousDelimiter;
    boolean active = true;

    Bracket(InlineNode node, boolean image, int textStart, Delimiter previousDelimiter) {
        this.node = node;
        this.image = image;
        this.textStart = textStart;
        this.previousDelimiter = previousDelimiter;
    }
}
