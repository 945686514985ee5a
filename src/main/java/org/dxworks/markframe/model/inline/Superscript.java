package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Superscript")
public class Superscript extends Inline {
    public List<Inline> content = new ArrayList<>();

    public Superscript() {
    }

    public Superscript(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Superscript";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Superscript other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 11;
    }

    @Override
    public String toString() {
        return "Superscript" + content;
    }
}
