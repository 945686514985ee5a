package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.Attr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table with column specifications, header rows, body rows and footer rows.
 * Every row holds exactly one cell per column.
 */
@JsonTypeName("Table")
public class Table extends Block {
    public Attr attr = new Attr();
    public List<Block> caption = new ArrayList<>();
    public List<TableColumn> columns = new ArrayList<>();
    public List<TableRow> head = new ArrayList<>();
    public List<TableRow> body = new ArrayList<>();
    public List<TableRow> foot = new ArrayList<>();

    public Table() {
    }

    /**
     * Builds a table whose first row is the header, padding short rows with empty cells and
     * dropping cells past the last column.
     */
    public static Table of(List<Alignment> alignments, List<TableRow> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("A table needs at least a header row");
        }
        Table table = new Table();
        for (Alignment alignment : alignments) {
            table.columns.add(new TableColumn(alignment));
        }
        int size = alignments.size();
        table.head.add(rows.get(0).fitTo(size));
        for (TableRow row : rows.subList(1, rows.size())) {
            table.body.add(row.fitTo(size));
        }
        return table;
    }

    public List<Alignment> alignments() {
        List<Alignment> result = new ArrayList<>();
        for (TableColumn column : columns) {
            result.add(column.alignment);
        }
        return result;
    }

    @Override
    public String kind() {
        return "Table";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        return attr.equals(other.attr)
                && caption.equals(other.caption)
                && columns.equals(other.columns)
                && head.equals(other.head)
                && body.equals(other.body)
                && foot.equals(other.foot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, caption, columns, head, body, foot);
    }

    @Override
    public String toString() {
        return "Table{" + columns + ", head=" + head + ", body=" + body + "}";
    }
}
