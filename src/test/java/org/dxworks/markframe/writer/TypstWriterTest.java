package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.TableRow;
import org.dxworks.markframe.reader.markdown.MarkdownReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.markframe.Trees.blocks;
import static org.dxworks.markframe.Trees.bullets;
import static org.dxworks.markframe.Trees.code;
import static org.dxworks.markframe.Trees.codeBlock;
import static org.dxworks.markframe.Trees.emph;
import static org.dxworks.markframe.Trees.heading;
import static org.dxworks.markframe.Trees.image;
import static org.dxworks.markframe.Trees.item;
import static org.dxworks.markframe.Trees.lineBreak;
import static org.dxworks.markframe.Trees.link;
import static org.dxworks.markframe.Trees.of;
import static org.dxworks.markframe.Trees.ordered;
import static org.dxworks.markframe.Trees.para;
import static org.dxworks.markframe.Trees.plain;
import static org.dxworks.markframe.Trees.quote;
import static org.dxworks.markframe.Trees.space;
import static org.dxworks.markframe.Trees.str;
import static org.dxworks.markframe.Trees.strikeout;
import static org.dxworks.markframe.Trees.strong;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TypstWriterTest {

    private static String write(Block... blocks) throws UnsupportedConstructException {
        return new TypstWriter().write(new Document(blocks(blocks)));
    }

    @Test
    void emptyDocument_isEmptyOutput() throws Exception {
        assertEquals("", write());
    }

    @Test
    void headingsAndParagraphs() throws Exception {
        assertEquals("=== Three\n\nbody text\n", write(heading(3, "Three"), para("body text")));
    }

    @Test
    void specialCharacters_areEscaped() throws Exception {
        assertEquals("a\\*b\\_c \\#d \\$e \\@f \\<g\\> \\/h\n", write(para("a*b_c #d $e @f <g> /h")));
    }

    @Test
    void leadingMarkerCharacter_isEscaped() throws Exception {
        assertEquals("\\- not a list\n", write(para("- not a list")));
        assertEquals("\\= not a heading\n", write(para("= not a heading")));
    }

    @Test
    void inlineMarkup() throws Exception {
        assertEquals("_a_ *b* #strike[c] #raw(\"say \\\"hi\\\"\")\n",
                write(para(of(emph(str("a")), space(), strong(str("b")), space(), strikeout(str("c")), space(),
                        code("say \"hi\"")))));
    }

    @Test
    void nestedEmphasisOfTheSameKind_isFlattened() throws Exception {
        assertEquals("_ab_\n", write(para(of(emph(str("a"), emph(str("b")))))));
        assertEquals("*_a b_*\n",
                write(para(of(strong(emph(str("a"), space(), strong(str("b"))))))));
    }

    @Test
    void linksImagesAndLineBreaks() throws Exception {
        assertEquals("#link(\"https://x.y/a b\")[go]\\\n#image(\"/i.png\")\n",
                write(para(of(link("https://x.y/a b", "", str("go")), lineBreak(), image("/i.png", "t", str("alt"))))));
    }

    @Test
    void codeBlock_fenceOutgrowsBackticksInside() throws Exception {
        assertEquals("```rust\nfn main() {}\n```\n", write(codeBlock("rust", "fn main() {}")));
        assertEquals("````\na ``` b\n````\n", write(codeBlock("", "a ``` b")));
    }

    @Test
    void blockQuoteAndThematicBreak() throws Exception {
        assertEquals("#quote(block: true)[\nq\n]\n\n#line(length: 100%)\n",
                write(quote(para("q")), new org.dxworks.markframe.model.block.ThematicBreak()));
    }

    @Test
    void lists() throws Exception {
        assertEquals("- a\n- b\n", write(bullets(item(plain("a")), item(plain("b")))));
        assertEquals("3. a\n\n4. b\n", write(ordered(3, '.', item(para("a")), item(para("b")))));
        assertEquals("- a\n  - b\n", write(bullets(item(plain("a"), bullets(item(plain("b")))))));
    }

    @Test
    void looseListWithoutParagraphs_keepsBlankLinesBetweenItems() throws Exception {
        Document document = new MarkdownReader().read("- # a\n\n- # b");
        assertEquals("- = a\n\n- = b\n", new TypstWriter().write(document));
    }

    @Test
    void table() throws Exception {
        Table table = Table.of(List.of(Alignment.LEFT, Alignment.DEFAULT), List.of(
                new TableRow(List.of(TableCell.of(of(str("h1"))), TableCell.of(of(str("h2"))))),
                new TableRow(List.of(TableCell.of(of(str("x")))))));

        assertEquals("#table(\n  columns: 2,\n  align: (left, auto),\n  [h1], [h2],\n  [x], [],\n)\n", write(table));
    }

    @Test
    void singleColumnTable_keepsAlignmentArray() throws Exception {
        Table table = Table.of(List.of(Alignment.CENTER), List.of(new TableRow(List.of(TableCell.of(of(str("x")))))));

        assertEquals("#table(\n  columns: 1,\n  align: (center,),\n  [x],\n)\n", write(table));
    }

    @Test
    void tableCellWithNestedBlocks_isRejected() {
        TableCell cell = new TableCell();
        cell.content.add(para("a"));
        cell.content.add(para("b"));
        Table table = Table.of(List.of(Alignment.DEFAULT), List.of(new TableRow(new ArrayList<>(List.of(cell)))));

        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> write(table));
        assertEquals("Table cell with nested blocks", e.getConstruct());
    }

    @ParameterizedTest
    @MethodSource("org.dxworks.markframe.writer.UnsupportedConstructs#blocks")
    void unsupportedVariants_areRejected(Block block) {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> write(block));
        String name = UnsupportedConstructs.nameOf(block);
        assertEquals(name, e.getConstruct());
        assertEquals(name + " is not supported by the Typst writer", e.getMessage());
    }
}
