package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("BlockQuote")
public class BlockQuote extends Block {
    public List<Block> blocks = new ArrayList<>();

    public BlockQuote() {
    }

    public BlockQuote(List<Block> blocks) {
        this.blocks = blocks;
    }

    @Override
    public String kind() {
        return "BlockQuote";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockQuote other)) return false;
        return blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return "BlockQuote" + blocks;
    }
}
