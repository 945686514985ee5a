package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

@JsonTypeName("Strong")
public class Strong extends Inline {
    public List<Inline> content = new ArrayList<>();

    public Strong() {
    }

    public Strong(List<Inline> content) {
        this.content = content;
    }

    @Override
    public String kind() {
        return "Strong";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Strong other)) return false;
        return content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode() * 31 + 6;
    }

    @Override
    public String toString() {
        return "Strong" + content;
    }
}
