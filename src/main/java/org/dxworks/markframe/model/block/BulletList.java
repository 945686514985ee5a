package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unordered list; each item is its own block sequence. {@code tight} is false when blank lines
 * separated the items or the blocks inside an item.
 */
@JsonTypeName("BulletList")
public class BulletList extends Block {
    public List<List<Block>> items = new ArrayList<>();
    public boolean tight = true;

    public BulletList() {
    }

    public BulletList(List<List<Block>> items) {
        this(items, withoutParagraphs(items));
    }

    public BulletList(List<List<Block>> items, boolean tight) {
        this.items = items;
        this.tight = tight;
    }

    @Override
    public String kind() {
        return "BulletList";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulletList other)) return false;
        return tight == other.tight && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, tight);
    }

    @Override
    public String toString() {
        return "BulletList" + (tight ? "" : "(loose)") + items;
    }
}
