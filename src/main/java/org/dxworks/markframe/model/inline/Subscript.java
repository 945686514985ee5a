package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Subscript")
public class Subscript extends Inline {
    public List<Inline> content = new ArrayList<>();

    public Subscript() {
    }

    public Subscript(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Subscript";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subscript other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 9;
    }

    @Override
    public String toString() {
        return "Subscript" + content;
    }
}
