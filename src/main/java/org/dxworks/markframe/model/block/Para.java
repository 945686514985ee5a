package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Para")
public class Para extends Block {
    public List<Inline> content = new ArrayList<>();

    public Para() {
    }

    public Para(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Para";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Para other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 4;
    }

    @Override
    public String toString() {
        return "Para" + content;
    }
}
