package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.Target;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Link")
public class Link extends Inline {
    public Attr attr = new Attr();
    public List<Inline> content = new ArrayList<>();
    public Target target = new Target();

    public Link() {
    }

    public Link(List<Inline> content, Target target) {
        this.content = content;
        this.target = target;
    }

    @Override
    public String kind() {
        return "Link";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link other)) return false;
        return attr.equals(other.attr) && content.equals(other.content) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, content, target);
    }

    @Override
    public String toString() {
        return "Link{" + content + ", " + target + "}";
    }
}
