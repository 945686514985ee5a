package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("LineBreak")
public class LineBreak extends Inline {

    @Override
    public String kind() {
        return "LineBreak";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LineBreak;
    }

    @Override
    public int hashCode() {
        return LineBreak.class.hashCode();
    }

    @Override
    public String toString() {
        return "LineBreak";
    }
}
