package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.TableRow;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;

import java.util.ArrayList;
import java.util.List;

/**
 * A GitHub pipe table: a header row, a delimiter row fixing the column count and alignments, then
 * body rows until a blank line or the start of another block.
 */
final class TableBlock extends OpenBlock {

    private final BlockStarts starts;
    private final List<Alignment> alignments;
    private final List<List<String>> rows = new ArrayList<>();

    private TableBlock(List<Alignment> alignments, List<String> header, BlockStarts starts) {
        this.alignments = alignments;
        this.starts = starts;
        rows.add(header);
    }

    /**
     * Opens a table when {@code delimiter} is a delimiter row with as many cells as {@code header}.
     */
    static TableBlock tryOpen(String header, Line delimiter, BlockStarts starts) {
        if (delimiter.indent() > 3) {
            return null;
        }
        List<Alignment> alignments = TableRows.parseDelimiterRow(delimiter.text());
        if (alignments == null) {
            return null;
        }
        List<String> cells = TableRows.split(header);
        if (cells.size() != alignments.size()) {
            return null;
        }
        return new TableBlock(alignments, cells, starts);
    }

    @Override
    public Kind kind() {
        return Kind.TABLE;
    }

    Transition next(Line line) {
        if (line.indent() < IndentedCodeBlock.CODE_INDENT) {
            OpenBlock block = starts.open(line, true);
            if (block != null) {
                return BlockStarts.isSingleLine(block)
                        ? Transition.finishedAndEmitted(block)
                        : Transition.finishedAndReplaced(block);
            }
        }
        rows.add(TableRows.split(line.text()));
        return Transition.UNCHANGED;
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        List<TableRow> tableRows = new ArrayList<>();
        for (List<String> row : rows) {
            List<TableCell> cells = new ArrayList<>();
            for (String cell : row) {
                cells.add(TableCell.of(inlines.parse(cell)));
            }
            tableRows.add(new TableRow(cells));
        }
        return Table.of(alignments, tableRows);
    }
}
