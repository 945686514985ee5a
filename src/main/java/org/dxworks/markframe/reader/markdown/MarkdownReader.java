package org.dxworks.markframe.reader.markdown;

import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.reader.DocumentReader;
import org.dxworks.markframe.reader.markdown.block.BlockParser;
import org.dxworks.markframe.reader.markdown.block.Line;
import org.dxworks.markframe.reader.markdown.block.OpenBlock;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.LinkReferences;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads GitHub Flavoured Markdown. Block structure is recognized first; inline content is parsed
 * once every link reference definition of the document is known. Never fails: anything that is
 * not recognized ends up as paragraph text.
 */
public class MarkdownReader implements DocumentReader {

    private final MarkdownOptions options;

    public MarkdownReader() {
        this(MarkdownOptions.defaults());
    }

    public MarkdownReader(MarkdownOptions options) {
        this.options = options;
    }

    @Override
    public Document read(String source) {
        BlockParser parser = new BlockParser(options);
        for (String line : lines(source)) {
            parser.feed(Line.scan(line, 0));
        }
        List<OpenBlock> openBlocks = parser.finish();

        LinkReferences references = new LinkReferences();
        for (OpenBlock block : openBlocks) {
            block.collectReferences(references);
        }

        InlineParser inlines = new InlineParser(references);
        List<Block> blocks = new ArrayList<>();
        for (OpenBlock openBlock : openBlocks) {
            Block block = openBlock.toBlock(inlines);
            if (block != null) {
                blocks.add(block);
            }
        }
        return new Document(blocks);
    }

    static List<String> lines(String source) {
        String text = source.replace('\u0000', '\uFFFD');
        List<String> lines = new ArrayList<>(List.of(text.split("\r\n|\r|\n", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
