package org.dxworks.markframe.model.block;

import org.dxworks.markframe.model.Alignment;

import java.util.Objects;

public class TableColumn {
    public Alignment alignment = Alignment.DEFAULT;
    public Double width; // fraction of the text width, null for the default

    public TableColumn() {
    }

    public TableColumn(Alignment alignment) {
        this.alignment = alignment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableColumn other)) return false;
        return alignment == other.alignment && Objects.equals(width, other.width);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alignment, width);
    }

    @Override
    public String toString() {
        return alignment.name();
    }
}
