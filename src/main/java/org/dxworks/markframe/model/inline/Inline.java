package org.dxworks.markframe.model.inline;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An inline element of a document. Serialized with a {@code "t"} property naming the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "t")
@JsonSubTypes({
        @JsonSubTypes.Type(Str.class),
        @JsonSubTypes.Type(Emph.class),
        @JsonSubTypes.Type(Underline.class),
        @JsonSubTypes.Type(Strong.class),
        @JsonSubTypes.Type(Strikeout.class),
        @JsonSubTypes.Type(Superscript.class),
        @JsonSubTypes.Type(Subscript.class),
        @JsonSubTypes.Type(SmallCaps.class),
        @JsonSubTypes.Type(Quoted.class),
        @JsonSubTypes.Type(Cite.class),
        @JsonSubTypes.Type(Code.class),
        @JsonSubTypes.Type(Space.class),
        @JsonSubTypes.Type(SoftBreak.class),
        @JsonSubTypes.Type(LineBreak.class),
        @JsonSubTypes.Type(Math.class),
        @JsonSubTypes.Type(RawInline.class),
        @JsonSubTypes.Type(Link.class),
        @JsonSubTypes.Type(Image.class),
        @JsonSubTypes.Type(Note.class),
        @JsonSubTypes.Type(Span.class)
})
public abstract class Inline {

    public abstract String kind();
}
