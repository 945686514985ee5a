package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.BulletList;
import org.dxworks.markframe.model.block.ListAttributes;
import org.dxworks.markframe.model.block.OrderedList;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

import java.util.ArrayList;
import java.util.List;

/**
 * A bullet or ordered list. Items share the marker character (bullet) or closing delimiter
 * (ordered); a different marker ends the list.
 * <p>
 * The list is loose when a blank line separates two items or two blocks inside one item, in which
 * case item paragraphs stay {@code Para}; otherwise they become {@code Plain}.
 */
final class ListBlock extends OpenBlock {

    private final BlockStarts starts;
    private final ListMarker first;
    private final List<ListItem> items = new ArrayList<>();
    // null once an item that started empty was ended by a blank line
    private ListItem current;
    private boolean loose;

    private ListBlock(ListMarker first, BlockStarts starts) {
        this.first = first;
        this.starts = starts;
        this.current = new ListItem(first, starts);
    }

    static ListBlock tryOpen(Line line, boolean interrupting, BlockStarts starts) {
        ListMarker marker = ListMarker.parse(line);
        if (marker == null) {
            return null;
        }
        if (interrupting && (marker.isEmpty() || marker.isOrdered() && marker.start != 1)) {
            return null;
        }
        return new ListBlock(marker, starts);
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    Transition next(Line line) {
        if (current != null && line.indent() >= current.contentColumn()) {
            current.feed(line.withoutIndent(current.contentColumn()));
            return Transition.UNCHANGED;
        }
        if (line.indent() < IndentedCodeBlock.CODE_INDENT) {
            if (ThematicBreak.matches(line)) {
                return Transition.finishedAndEmitted(ThematicBreak.INSTANCE);
            }
            ListMarker marker = ListMarker.parse(line);
            if (marker != null) {
                if (marker.sameListAs(first)) {
                    startItem(marker);
                    return Transition.UNCHANGED;
                }
                return Transition.finishedAndReplaced(new ListBlock(marker, starts));
            }
        }
        if (tryLazyContinuation(line)) {
            return Transition.UNCHANGED;
        }
        return starts.closeAndStart(line);
    }

    /**
     * @return whether the blank line separates blocks, which it does not inside fenced code
     */
    boolean blank(int indent) {
        if (current == null) {
            return true;
        }
        if (current.isEmpty()) {
            current.close();
            items.add(current);
            current = null;
            return true;
        }
        return current.blank(indent);
    }

    boolean tryLazyContinuation(Line line) {
        return current != null && current.tryLazyContinuation(line);
    }

    private void startItem(ListMarker marker) {
        if (current == null || current.endsWithGap()) {
            loose = true;
        }
        if (current != null) {
            closeItem(current);
        }
        current = new ListItem(marker, starts);
    }

    private void closeItem(ListItem item) {
        if (item.isLoose()) {
            loose = true;
        }
        item.close();
        items.add(item);
    }

    @Override
    void close() {
        if (current != null) {
            closeItem(current);
            current = null;
        }
    }

    @Override
    public void collectReferences(LinkReferences references) {
        for (ListItem item : items) {
            item.collectReferences(references);
        }
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        List<List<Block>> blocks = new ArrayList<>();
        for (ListItem item : items) {
            blocks.add(item.toBlocks(loose, inlines));
        }
        if (first.isOrdered()) {
            return new OrderedList(ListAttributes.decimal(first.start, first.closing), blocks, !loose);
        }
        return new BulletList(blocks, !loose);
    }
}
