package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * A word: text without spaces or line breaks.
 */
@JsonTypeName("Str")
public class Str extends Inline {
    public String text = "";

    public Str() {
    }

    public Str(String text) {
        this.text = text;
    }

    @Override
    public String kind() {
        return "Str";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Str other)) return false;
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Str(" + text + ")";
    }
}
