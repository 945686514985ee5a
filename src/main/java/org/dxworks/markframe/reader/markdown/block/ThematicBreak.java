package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;

final class ThematicBreak extends OpenBlock {

    static final ThematicBreak INSTANCE = new ThematicBreak();

    private ThematicBreak() {
    }

    /**
     * Three or more of the same {@code * - _}, optionally separated by spaces or tabs.
     */
    static boolean matches(Line line) {
        if (line.isBlank() || line.indent() > 3) {
            return false;
        }
        char marker = line.first();
        if (marker != '*' && marker != '-' && marker != '_') {
            return false;
        }
        int count = 0;
        String text = line.text();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == marker) {
                count++;
            } else if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return count >= 3;
    }

    @Override
    public Kind kind() {
        return Kind.THEMATIC_BREAK;
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        return new org.dxworks.markframe.model.block.ThematicBreak();
    }
}
