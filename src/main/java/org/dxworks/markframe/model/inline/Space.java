package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("Space")
public class Space extends Inline {

    @Override
    public String kind() {
        return "Space";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Space;
    }

    @Override
    public int hashCode() {
        return Space.class.hashCode();
    }

    @Override
    public String toString() {
        return "Space";
    }
}
