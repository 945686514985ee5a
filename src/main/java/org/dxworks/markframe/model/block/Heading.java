package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Section heading, level 1 to 6. Attributes take no part in equality.
 */
@JsonTypeName("Heading")
public class Heading extends Block {
    public int level;
    public Attr attr = new Attr();
    public List<Inline> content = new ArrayList<>();

    public Heading() {
    }

    public Heading(int level, List<Inline> content) {
        this.level = level;
        this.content = content;
    }

    @Override
    public String kind() {
        return "Heading";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Heading other)) return false;
        return level == other.level && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, content);
    }

    @Override
    public String toString() {
        return "Heading{" + level + ", " + content + "}";
    }
}
