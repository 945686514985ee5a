package org.dxworks.markframe.reader.markdown.inline;

/**
 * A run of {@code *}, {@code _} or {@code ~} that may open or close emphasis, kept on a stack
 * linked through {@link #prev} and {@link #next}.
 */
final class Delimiter {

    final InlineNode node;
    final char character;
    final int originalLength;
    final boolean canOpen;
    final boolean canClose;
    int length;
    Delimiter prev;
    Delimiter next;

    Delimiter(InlineNode node, char character, int length, boolean canOpen, boolean canClose) {
        this.node = node;
        this.character = character;
        this.length = length;
        this.originalLength = length;
        this.canOpen = canOpen;
        this.canClose = canClose;
    }
}
