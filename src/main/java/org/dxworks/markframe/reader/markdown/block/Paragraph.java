package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Heading;
import org.dxworks.markframe.model.block.Para;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReference;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

import java.util.ArrayList;
import java.util.List;

/**
 * Paragraph text, which may still turn into a setext heading, a table or a run of link reference
 * definitions.
 */
final class Paragraph extends OpenBlock {

    private final BlockStarts starts;
    // each entry is the line text without its indent; trailing whitespace is kept for hard breaks
    private final List<String> lines = new ArrayList<>();
    private final List<LinkReference> definitions = new ArrayList<>();
    private int setextLevel;
    private String underline;

    Paragraph(Line line, BlockStarts starts) {
        this.starts = starts;
        lines.add(line.text());
    }

    @Override
    public Kind kind() {
        return Kind.PARAGRAPH;
    }

    Transition next(Line line) {
        if (line.indent() >= IndentedCodeBlock.CODE_INDENT) {
            lines.add(line.text());
            return Transition.UNCHANGED;
        }
        char c = line.first();
        if ((c == '=' || c == '-') && isSetextUnderline(line.text(), c)) {
            setextLevel = c == '=' ? 1 : 2;
            underline = line.text();
            return Transition.FINISHED;
        }
        if (starts.options().isTables() && (c == '|' || c == ':' || c == '-')) {
            TableBlock table = TableBlock.tryOpen(lines.get(lines.size() - 1), line, starts);
            if (table != null) {
                lines.remove(lines.size() - 1);
                return lines.isEmpty() ? Transition.replaced(table) : Transition.finishedAndReplaced(table);
            }
        }
        OpenBlock block = starts.open(line, true);
        if (block == null) {
            lines.add(line.text());
            return Transition.UNCHANGED;
        }
        return BlockStarts.isSingleLine(block) ? Transition.finishedAndEmitted(block) : Transition.finishedAndReplaced(block);
    }

    /**
     * Appends {@code line} as a lazy continuation unless it opens a block of its own.
     */
    boolean tryLazy(Line line) {
        if (line.indent() < IndentedCodeBlock.CODE_INDENT && starts.open(line, true) != null) {
            return false;
        }
        lines.add(line.text());
        return true;
    }

    private static boolean isSetextUnderline(String text, char c) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == c) {
            i++;
        }
        return text.substring(i).isBlank();
    }

    @Override
    void close() {
        String content = String.join("\n", lines);
        LinkReferenceDefinitionParser.Result result = LinkReferenceDefinitionParser.parse(content);
        if (result.definitions().isEmpty()) {
            return;
        }
        definitions.addAll(result.definitions());
        lines.clear();
        if (!result.remainder().isEmpty()) {
            lines.addAll(List.of(result.remainder().split("\n", -1)));
        } else if (setextLevel > 0) {
            lines.add(underline);
            setextLevel = 0;
        }
    }

    @Override
    public void collectReferences(LinkReferences references) {
        for (LinkReference definition : definitions) {
            references.add(definition);
        }
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        if (lines.isEmpty()) {
            return null;
        }
        String content = String.join("\n", lines).strip();
        if (setextLevel > 0) {
            return new Heading(setextLevel, inlines.parse(content));
        }
        return new Para(inlines.parse(content));
    }
}
