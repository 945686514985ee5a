package org.dxworks.markframe.model.block;

import org.dxworks.markframe.model.Attr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class TableRow {
    public Attr attr = new Attr();
    public List<TableCell> cells = new ArrayList<>();

    public TableRow() {
    }

    public TableRow(List<TableCell> cells) {
        this.cells = cells;
    }

    TableRow fitTo(int size) {
        List<TableCell> fitted = new ArrayList<>(cells.subList(0, Math.min(size, cells.size())));
        while (fitted.size() < size) {
            fitted.add(new TableCell());
        }
        TableRow row = new TableRow(fitted);
        row.attr = attr;
        return row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableRow other)) return false;
        return attr.equals(other.attr) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, cells);
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
