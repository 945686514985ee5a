package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code >} block quote. The text after each marker is fed to a nested parser.
 */
final class BlockQuote extends OpenBlock {

    private final BlockStarts starts;
    private final BlockParser nested;
    private List<OpenBlock> children = List.of();

    BlockQuote(Line line, BlockStarts starts) {
        this.starts = starts;
        this.nested = new BlockParser(starts);
        feedMarkerContent(line);
    }

    @Override
    public Kind kind() {
        return Kind.BLOCK_QUOTE;
    }

    Transition next(Line line) {
        if (line.indent() <= 3 && line.first() == '>') {
            feedMarkerContent(line);
            return Transition.UNCHANGED;
        }
        if (nested.tryLazyContinuation(line)) {
            return Transition.UNCHANGED;
        }
        return starts.closeAndStart(line);
    }

    boolean tryLazyContinuation(Line line) {
        return nested.tryLazyContinuation(line);
    }

    // one space after the marker belongs to the marker
    private void feedMarkerContent(Line line) {
        Line content = line.rest().withoutIndent(1);
        if (content.isBlank()) {
            nested.feedBlank(content.indent());
        } else {
            nested.feed(content);
        }
    }

    @Override
    void close() {
        children = nested.finish();
    }

    @Override
    public void collectReferences(LinkReferences references) {
        for (OpenBlock child : children) {
            child.collectReferences(references);
        }
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        List<Block> blocks = new ArrayList<>();
        for (OpenBlock child : children) {
            Block block = child.toBlock(inlines);
            if (block != null) {
                blocks.add(block);
            }
        }
        return new org.dxworks.markframe.model.block.BlockQuote(blocks);
    }
}
