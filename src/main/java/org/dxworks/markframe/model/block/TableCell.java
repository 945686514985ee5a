package org.dxworks.markframe.model.block;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class TableCell {
    public Attr attr = new Attr();
    public Alignment alignment = Alignment.DEFAULT;
    public int rowSpan = 1;
    public int colSpan = 1;
    public List<Block> content = new ArrayList<>();

    public TableCell() {
    }

    /**
     * A cell holding a single {@link Plain} block, or nothing when {@code inlines} is empty.
     */
    public static TableCell of(List<Inline> inlines) {
        TableCell cell = new TableCell();
        if (!inlines.isEmpty()) {
            cell.content.add(new Plain(inlines));
        }
        return cell;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableCell other)) return false;
        return rowSpan == other.rowSpan
                && colSpan == other.colSpan
                && alignment == other.alignment
                && attr.equals(other.attr)
                && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, alignment, rowSpan, colSpan, content);
    }

    @Override
    public String toString() {
        return content.toString();
    }
}
