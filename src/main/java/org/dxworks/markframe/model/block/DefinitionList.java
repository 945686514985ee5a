package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Terms with one or more definitions each. Never produced by the Markdown reader.
 */
@JsonTypeName("DefinitionList")
public class DefinitionList extends Block {
    public List<Item> items = new ArrayList<>();

    public static class Item {
        public List<Inline> term = new ArrayList<>();
        public List<List<Block>> definitions = new ArrayList<>();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Item other)) return false;
            return term.equals(other.term) && definitions.equals(other.definitions);
        }

        @Override
        public int hashCode() {
            return Objects.hash(term, definitions);
        }
    }

    @Override
    public String kind() {
        return "DefinitionList";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DefinitionList other)) return false;
        return items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }
}
