package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Figure")
public class Figure extends Block {
    public Attr attr = new Attr();
    public List<Block> caption = new ArrayList<>();
    public List<Block> content = new ArrayList<>();

    @Override
    public String kind() {
        return "Figure";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Figure other)) return false;
        return attr.equals(other.attr) && caption.equals(other.caption) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, caption, content);
    }
}
