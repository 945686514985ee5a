package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Heading;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;

/**
 * A {@code #}-prefixed heading. Always complete after its single line.
 */
final class AtxHeading extends OpenBlock {

    private static final int MAX_LEVEL = 6;

    private final int level;
    private final String content;

    private AtxHeading(int level, String content) {
        this.level = level;
        this.content = content;
    }

    /**
     * Recognizes {@code line} (indent at most 3, first character {@code #}) or returns {@code null}.
     */
    static AtxHeading tryParse(Line line) {
        String text = line.text();
        int level = 0;
        while (level < text.length() && text.charAt(level) == '#') {
            level++;
        }
        if (level > MAX_LEVEL) {
            return null;
        }
        if (level < text.length() && !isSpaceOrTab(text.charAt(level))) {
            return null;
        }
        String content = text.substring(level).strip();
        int end = content.length();
        while (end > 0 && content.charAt(end - 1) == '#') {
            end--;
        }
        if (end == 0) {
            content = "";
        } else if (end < content.length() && isSpaceOrTab(content.charAt(end - 1))) {
            content = content.substring(0, end).stripTrailing();
        }
        return new AtxHeading(level, content);
    }

    private static boolean isSpaceOrTab(char c) {
        return c == ' ' || c == '\t';
    }

    @Override
    public Kind kind() {
        return Kind.ATX_HEADING;
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        return new Heading(level, inlines.parse(content));
    }
}
