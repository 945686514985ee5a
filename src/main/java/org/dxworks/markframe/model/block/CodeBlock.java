package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;

import java.util.Objects;

/**
 * Literal code. The info string of a fenced block, when present, is the first class of {@link #attr}.
 */
@JsonTypeName("CodeBlock")
public class CodeBlock extends Block {
    public Attr attr = new Attr();
    public String text = "";

    public CodeBlock() {
    }

    public CodeBlock(Attr attr, String text) {
        this.attr = attr;
        this.text = text;
    }

    public String language() {
        return attr.classes.isEmpty() ? "" : attr.classes.get(0);
    }

    @Override
    public String kind() {
        return "CodeBlock";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeBlock other)) return false;
        return attr.equals(other.attr) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, text);
    }

    @Override
    public String toString() {
        return "CodeBlock{" + attr.classes + ", " + text + "}";
    }
}
