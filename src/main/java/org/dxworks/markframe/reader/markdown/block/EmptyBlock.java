package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;

/**
 * Placeholder for "no block open".
 */
final class EmptyBlock extends OpenBlock {

    static final EmptyBlock INSTANCE = new EmptyBlock();

    private EmptyBlock() {
    }

    @Override
    public Kind kind() {
        return Kind.EMPTY;
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        return null;
    }
}
