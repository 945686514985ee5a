package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.DefinitionList;
import org.dxworks.markframe.model.block.Div;
import org.dxworks.markframe.model.block.Figure;
import org.dxworks.markframe.model.block.LineBlock;
import org.dxworks.markframe.model.block.Para;
import org.dxworks.markframe.model.block.RawBlock;
import org.dxworks.markframe.model.inline.Cite;
import org.dxworks.markframe.model.inline.Inline;
import org.dxworks.markframe.model.inline.Note;
import org.dxworks.markframe.model.inline.Quoted;
import org.dxworks.markframe.model.inline.RawInline;
import org.dxworks.markframe.model.inline.SmallCaps;
import org.dxworks.markframe.model.inline.Span;
import org.dxworks.markframe.model.inline.Subscript;
import org.dxworks.markframe.model.inline.Superscript;
import org.dxworks.markframe.model.inline.Underline;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Variants the markup writers have no rendering for, each wrapped so it can be written on its own.
 */
final class UnsupportedConstructs {

    private UnsupportedConstructs() {
    }

    static Stream<Block> blocks() {
        List<Block> blocks = new ArrayList<>(List.of(
                new LineBlock(), new RawBlock("html", "<hr>"), new DefinitionList(), new Figure(), new Div()));
        for (Inline inline : List.of(new Underline(), new Superscript(), new Subscript(), new SmallCaps(),
                new Quoted(), new Cite(), new org.dxworks.markframe.model.inline.Math(),
                new RawInline(), new Note(), new Span())) {
            blocks.add(new Para(new ArrayList<>(List.of(inline))));
        }
        return blocks.stream();
    }

    /**
     * The construct name expected in the exception for a value of {@link #blocks()}.
     */
    static String nameOf(Block block) {
        if (block instanceof Para para) {
            return para.content.get(0).kind();
        }
        return block.kind();
    }
}
