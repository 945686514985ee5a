package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.block.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Footnote or endnote.
 */
@JsonTypeName("Note")
public class Note extends Inline {
    public List<Block> blocks = new ArrayList<>();

    @Override
    public String kind() {
        return "Note";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Note other)) return false;
        return blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }
}
