package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("ThematicBreak")
public class ThematicBreak extends Block {

    @Override
    public String kind() {
        return "ThematicBreak";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ThematicBreak;
    }

    @Override
    public int hashCode() {
        return ThematicBreak.class.hashCode();
    }

    @Override
    public String toString() {
        return "ThematicBreak";
    }
}
