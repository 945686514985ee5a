package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonTypeName("Quoted")
public class Quoted extends Inline {
    public QuoteType quoteType = QuoteType.DOUBLE_QUOTE;
    public List<Inline> content = new ArrayList<>();

    public enum QuoteType {
        SINGLE_QUOTE,
        DOUBLE_QUOTE
    }

    @Override
    public String kind() {
        return "Quoted";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quoted other)) return false;
        return quoteType == other.quoteType && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quoteType, content);
    }
}
