package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Para;
import org.dxworks.markframe.model.block.Plain;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

import java.util.ArrayList;
import java.util.List;

final class ListItem {

    private final int contentColumn;
    private final BlockParser nested;
    private List<OpenBlock> children = List.of();
    private boolean pendingGap;
    private boolean loose;

    ListItem(ListMarker marker, BlockStarts starts) {
        this.contentColumn = marker.indent + marker.width;
        this.nested = new BlockParser(starts);
        if (marker.content != null) {
            nested.feed(marker.content);
        }
    }

    int contentColumn() {
        return contentColumn;
    }

    boolean isEmpty() {
        return nested.isEmpty();
    }

    /**
     * Whether a blank line separated two blocks of this item.
     */
    boolean isLoose() {
        return loose;
    }

    /**
     * Whether a blank line was the last thing this item saw.
     */
    boolean endsWithGap() {
        return pendingGap;
    }

    /**
     * Feeds a line whose indent is already relative to the content column.
     */
    void feed(Line line) {
        boolean started = nested.feed(line);
        if (pendingGap && started) {
            loose = true;
        }
        pendingGap = false;
    }

    boolean blank(int indent) {
        boolean separates = nested.feedBlank(Math.max(0, indent - contentColumn));
        if (separates) {
            pendingGap = true;
        }
        return separates;
    }

    boolean tryLazyContinuation(Line line) {
        return nested.tryLazyContinuation(line);
    }

    void close() {
        children = nested.finish();
    }

    void collectReferences(LinkReferences references) {
        for (OpenBlock child : children) {
            child.collectReferences(references);
        }
    }

    List<Block> toBlocks(boolean looseList, InlineParser inlines) {
        List<Block> blocks = new ArrayList<>();
        for (OpenBlock child : children) {
            Block block = child.toBlock(inlines);
            if (block == null) {
                continue;
            }
            if (!looseList && block instanceof Para para) {
                blocks.add(new Plain(para.content));
            } else {
                blocks.add(block);
            }
        }
        return blocks;
    }
}
