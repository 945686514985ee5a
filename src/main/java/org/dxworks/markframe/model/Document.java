package org.dxworks.markframe.model;

import org.dxworks.markframe.model.block.Block;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a parsed document: the top-level blocks plus opaque metadata.
 * Readers produce it, writers consume it; the Markdown reader never touches {@link #meta}.
 */
public class Document {
    public Map<String, Object> meta = new LinkedHashMap<>();
    public List<Block> blocks = new ArrayList<>();

    public Document() {
    }

    public Document(List<Block> blocks) {
        this.blocks = blocks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return meta.equals(other.meta) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(meta, blocks);
    }

    @Override
    public String toString() {
        return "Document{meta=" + meta + ", blocks=" + blocks + "}";
    }
}
