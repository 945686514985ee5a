package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("SoftBreak")
public class SoftBreak extends Inline {

    @Override
    public String kind() {
        return "SoftBreak";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SoftBreak;
    }

    @Override
    public int hashCode() {
        return SoftBreak.class.hashCode();
    }

    @Override
    public String toString() {
        return "SoftBreak";
    }
}
