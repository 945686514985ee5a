package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

/**
 * A block while the document is being read. The set of kinds is closed; {@link BlockParser}
 * dispatches on {@link #kind()} instead of on virtual line handlers.
 */
public abstract class OpenBlock {

    public enum Kind {
        EMPTY,
        PARAGRAPH,
        ATX_HEADING,
        THEMATIC_BREAK,
        INDENTED_CODE,
        FENCED_CODE,
        TABLE,
        BLOCK_QUOTE,
        LIST
    }

    public abstract Kind kind();

    /**
     * Called once when the block stops accepting lines.
     */
    void close() {
    }

    /**
     * Registers the link reference definitions found in this block, in document order.
     */
    public void collectReferences(LinkReferences references) {
    }

    /**
     * Builds the finished tree node, or {@code null} when the block turned out to hold nothing.
     */
    public abstract Block toBlock(InlineParser inlines);
}
