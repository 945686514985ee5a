package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Underline")
public class Underline extends Inline {
    public List<Inline> content = new ArrayList<>();

    public Underline() {
    }

    public Underline(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Underline";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Underline other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 9;
    }

    @Override
    public String toString() {
        return "Underline" + content;
    }
}
