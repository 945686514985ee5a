package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generic block container.
 */
@JsonTypeName("Div")
public class Div extends Block {
    public Attr attr = new Attr();
    public List<Block> blocks = new ArrayList<>();

    @Override
    public String kind() {
        return "Div";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Div other)) return false;
        return attr.equals(other.attr) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, blocks);
    }
}
