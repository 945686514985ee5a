package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("OrderedList")
public class OrderedList extends Block {
    public ListAttributes attributes = new ListAttributes();
    public List<List<Block>> items = new ArrayList<>();
    public boolean tight = true;

    public OrderedList() {
    }

    public OrderedList(ListAttributes attributes, List<List<Block>> items) {
        this(attributes, items, withoutParagraphs(items));
    }

    public OrderedList(ListAttributes attributes, List<List<Block>> items, boolean tight) {
        this.attributes = attributes;
        this.items = items;
        this.tight = tight;
    }

    @Override
    public String kind() {
        return "OrderedList";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderedList other)) return false;
        return tight == other.tight && attributes.equals(other.attributes) && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, items, tight);
    }

    @Override
    public String toString() {
        return "OrderedList" + attributes + (tight ? "" : "(loose)") + items;
    }
}
