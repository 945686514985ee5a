package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.BlockQuote;
import org.dxworks.markframe.model.block.BulletList;
import org.dxworks.markframe.model.block.CodeBlock;
import org.dxworks.markframe.model.block.Heading;
import org.dxworks.markframe.model.block.OrderedList;
import org.dxworks.markframe.model.block.Para;
import org.dxworks.markframe.model.block.Plain;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.ThematicBreak;
import org.dxworks.markframe.model.inline.Code;
import org.dxworks.markframe.model.inline.Emph;
import org.dxworks.markframe.model.inline.Image;
import org.dxworks.markframe.model.inline.Inline;
import org.dxworks.markframe.model.inline.LineBreak;
import org.dxworks.markframe.model.inline.Link;
import org.dxworks.markframe.model.inline.SoftBreak;
import org.dxworks.markframe.model.inline.Space;
import org.dxworks.markframe.model.inline.Str;
import org.dxworks.markframe.model.inline.Strikeout;
import org.dxworks.markframe.model.inline.Strong;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the text markup writers. Dispatches on the variants GitHub Flavoured Markdown can produce
 * and rejects every other variant with {@link UnsupportedConstructException}.
 */
public abstract class MarkupWriter implements DocumentWriter {

    protected abstract String formatName();

    @Override
    public String write(Document document) throws UnsupportedConstructException {
        return document(blocks(document.blocks));
    }

    /**
     * Wraps the rendered top-level blocks into a complete output file.
     */
    protected abstract String document(String body);

    protected String blocks(List<Block> blocks) throws UnsupportedConstructException {
        List<String> rendered = new ArrayList<>();
        for (Block block : blocks) {
            rendered.add(block(block));
        }
        return String.join("\n\n", rendered);
    }

    /**
     * The blocks of one list item, separated by a blank line only in loose lists.
     */
    protected String item(List<Block> item, boolean tight) throws UnsupportedConstructException {
        List<String> rendered = new ArrayList<>();
        for (Block block : item) {
            rendered.add(block(block));
        }
        return String.join(tight ? "\n" : "\n\n", rendered);
    }

    protected String block(Block block) throws UnsupportedConstructException {
        if (block instanceof Plain plain) {
            return paragraph(plain.content);
        } else if (block instanceof Para para) {
            return paragraph(para.content);
        } else if (block instanceof Heading heading) {
            return heading(heading.level, heading.content);
        } else if (block instanceof ThematicBreak) {
            return thematicBreak();
        } else if (block instanceof CodeBlock codeBlock) {
            return codeBlock(codeBlock.language(), codeBlock.text);
        } else if (block instanceof BlockQuote quote) {
            return blockQuote(quote.blocks);
        } else if (block instanceof BulletList list) {
            return bulletList(list.items, list.tight);
        } else if (block instanceof OrderedList list) {
            return orderedList(list.attributes.start, list.items, list.tight);
        } else if (block instanceof Table table) {
            return table(table);
        }
        throw unsupported(block.kind());
    }

    protected abstract String paragraph(List<Inline> content) throws UnsupportedConstructException;

    protected abstract String heading(int level, List<Inline> content) throws UnsupportedConstructException;

    protected abstract String thematicBreak();

    protected abstract String codeBlock(String language, String text);

    protected abstract String blockQuote(List<Block> blocks) throws UnsupportedConstructException;

    protected abstract String bulletList(List<List<Block>> items, boolean tight) throws UnsupportedConstructException;

    protected abstract String orderedList(int start, List<List<Block>> items, boolean tight)
            throws UnsupportedConstructException;

    protected abstract String table(Table table) throws UnsupportedConstructException;

    protected String inlines(List<Inline> inlines) throws UnsupportedConstructException {
        StringBuilder result = new StringBuilder();
        for (Inline inline : inlines) {
            result.append(inline(inline));
        }
        return result.toString();
    }

    protected String inline(Inline inline) throws UnsupportedConstructException {
        if (inline instanceof Str str) {
            return escape(str.text);
        } else if (inline instanceof Space || inline instanceof SoftBreak) {
            return " ";
        } else if (inline instanceof LineBreak) {
            return lineBreak();
        } else if (inline instanceof Emph emph) {
            return emph(emph.content);
        } else if (inline instanceof Strong strong) {
            return strong(strong.content);
        } else if (inline instanceof Strikeout strikeout) {
            return strikeout(strikeout.content);
        } else if (inline instanceof Code code) {
            return code(code.text);
        } else if (inline instanceof Link link) {
            return link(link.target.url, link.content);
        } else if (inline instanceof Image image) {
            return image(image.target.url, image.content);
        }
        throw unsupported(inline.kind());
    }

    protected abstract String escape(String text);

    protected abstract String lineBreak();

    protected abstract String emph(List<Inline> content) throws UnsupportedConstructException;

    protected abstract String strong(List<Inline> content) throws UnsupportedConstructException;

    protected abstract String strikeout(List<Inline> content) throws UnsupportedConstructException;

    protected abstract String code(String text);

    protected abstract String link(String url, List<Inline> content) throws UnsupportedConstructException;

    protected abstract String image(String url, List<Inline> description) throws UnsupportedConstructException;

    /**
     * The inline content of a cell holding nothing or a single plain block.
     */
    protected List<Inline> cellContent(TableCell cell) throws UnsupportedConstructException {
        if (cell.content.isEmpty()) {
            return List.of();
        }
        if (cell.content.size() == 1 && cell.content.get(0) instanceof Plain plain) {
            return plain.content;
        }
        throw unsupported("Table cell with nested blocks");
    }

    protected UnsupportedConstructException unsupported(String construct) {
        return new UnsupportedConstructException(construct, formatName());
    }

    /**
     * Prefixes every line after the first with {@code prefix}, leaving empty lines empty.
     */
    static String indentFollowingLines(String text, String prefix) {
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            result.append('\n');
            if (!lines[i].isEmpty()) {
                result.append(prefix).append(lines[i]);
            }
        }
        return result.toString();
    }
}
