package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

@JsonTypeName("Math")
public class Math extends Inline {
    public MathType mathType = MathType.INLINE_MATH;
    public String text = "";

    public enum MathType {
        DISPLAY_MATH,
        INLINE_MATH
    }

    @Override
    public String kind() {
        return "Math";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Math other)) return false;
        return mathType == other.mathType && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mathType, text);
    }
}
