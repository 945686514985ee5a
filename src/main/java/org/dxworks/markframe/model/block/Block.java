package org.dxworks.markframe.model.block;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A block-level element of a document. Serialized with a {@code "t"} property naming the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "t")
@JsonSubTypes({
        @JsonSubTypes.Type(Plain.class),
        @JsonSubTypes.Type(Para.class),
        @JsonSubTypes.Type(LineBlock.class),
        @JsonSubTypes.Type(CodeBlock.class),
        @JsonSubTypes.Type(RawBlock.class),
        @JsonSubTypes.Type(BlockQuote.class),
        @JsonSubTypes.Type(OrderedList.class),
        @JsonSubTypes.Type(BulletList.class),
        @JsonSubTypes.Type(DefinitionList.class),
        @JsonSubTypes.Type(Heading.class),
        @JsonSubTypes.Type(ThematicBreak.class),
        @JsonSubTypes.Type(Table.class),
        @JsonSubTypes.Type(Figure.class),
        @JsonSubTypes.Type(Div.class)
})
public abstract class Block {

    /**
     * Name of the variant, the same string used as the JSON type tag.
     */
    public abstract String kind();

    /**
     * Tightness of a list built by hand: items holding no {@link Para} read as tight.
     */
    static boolean withoutParagraphs(List<List<Block>> items) {
        for (List<Block> item : items) {
            for (Block block : item) {
                if (block instanceof Para) {
                    return false;
                }
            }
        }
        return true;
    }
}
