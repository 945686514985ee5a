package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequence of non-breaking lines. Never produced by the Markdown reader.
 */
@JsonTypeName("LineBlock")
public class LineBlock extends Block {
    public List<List<Inline>> lines = new ArrayList<>();

    public LineBlock() {
    }

    public LineBlock(List<List<Inline>> lines) {
        this.lines = lines;
    }

    @Override
    public String kind() {
        return "LineBlock";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineBlock other)) return false;
        return lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }
}
