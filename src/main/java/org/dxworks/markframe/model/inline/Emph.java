package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Emph")
public class Emph extends Inline {
    public List<Inline> content = new ArrayList<>();

    public Emph() {
    }

    public Emph(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Emph";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Emph other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 4;
    }

    @Override
    public String toString() {
        return "Emph" + content;
    }
}
