package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonTypeName("RawBlock")
public class RawBlock extends Block {
    public String format = "";
    public String text = "";

    public RawBlock() {
    }

    public RawBlock(String format, String text) {
        this.format = format;
        this.text = text;
    }

    @Override
    public String kind() {
        return "RawBlock";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawBlock other)) return false;
        return format.equals(other.format) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, text);
    }
}
