package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Inline content not wrapped in a paragraph, used for tight list items and table cells.
 */
@JsonTypeName("Plain")
public class Plain extends Block {
    public List<Inline> content = new ArrayList<>();

    public Plain() {
    }

    public Plain(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Plain";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plain other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 5;
    }

    @Override
    public String toString() {
        return "Plain" + content;
    }
}
