package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;
import org.dxworks.markframe.model.Attr;

import java.util.Objects;

/**
 * Code span; the text is literal and never inline-parsed.
 */
@JsonTypeName("Code")
public class Code extends Inline {
    public Attr attr = new Attr();
    public String text = "";

    public Code() {
    }

    public Code(String text) {
        this.text = text;
    }

    @Override
    public String kind() {
        return "Code";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Code other)) return false;
        return attr.equals(other.attr) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attr, text);
    }

    @Override
    public String toString() {
        return "Code(" + text + ")";
    }
}
