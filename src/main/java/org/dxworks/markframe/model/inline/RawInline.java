package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonTypeName("RawInline")
public class RawInline extends Inline {
    public String format = "";
    public String text = "";

    @Override
    public String kind() {
        return "RawInline";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawInline other)) return false;
        return format.equals(other.format) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, text);
    }
}
