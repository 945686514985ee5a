package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Span")
public class Span extends Inline {
    public Attr attr = new Attr();
    public List<Inline> content = new ArrayList<>();

    @Override
    public String kind() {
        return "Span";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span other)) return false;
        return attr.equals(other.attr) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, content);
    }
}
