package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.CodeBlock;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;
import org.dxworks.markframe.reader.markdown.inline.InlineText;

import java.util.ArrayList;
import java.util.List;

/**
 * Code between a pair of {@code ```} or {@code ~~~} fences. The first word of the info string becomes
 * the language class.
 */
final class FencedCodeBlock extends OpenBlock {

    private static final int MIN_FENCE = 3;

    private final char fenceChar;
    private final int fenceLength;
    private final int indent;
    private final String language;
    private final List<String> lines = new ArrayList<>();

    private FencedCodeBlock(char fenceChar, int fenceLength, int indent, String language) {
        this.fenceChar = fenceChar;
        this.fenceLength = fenceLength;
        this.indent = indent;
        this.language = language;
    }

    static FencedCodeBlock tryOpen(Line line) {
        char fenceChar = line.first();
        String text = line.text();
        int length = runLength(text, fenceChar);
        if (length < MIN_FENCE) {
            return null;
        }
        String info = text.substring(length).strip();
        if (fenceChar == '`' && info.indexOf('`') >= 0) {
            return null;
        }
        String language = "";
        if (!info.isEmpty()) {
            int space = 0;
            while (space < info.length() && !Character.isWhitespace(info.charAt(space))) {
                space++;
            }
            language = InlineText.unescape(info.substring(0, space));
        }
        return new FencedCodeBlock(fenceChar, length, line.indent(), language);
    }

    private static int runLength(String text, char c) {
        int length = 0;
        while (length < text.length() && text.charAt(length) == c) {
            length++;
        }
        return length;
    }

    @Override
    public Kind kind() {
        return Kind.FENCED_CODE;
    }

    Transition next(Line line) {
        if (isClosingFence(line)) {
            return Transition.FINISHED;
        }
        lines.add(line.withoutIndent(indent).content());
        return Transition.UNCHANGED;
    }

    private boolean isClosingFence(Line line) {
        if (line.indent() > 3 || line.first() != fenceChar) {
            return false;
        }
        String text = line.text();
        int length = runLength(text, fenceChar);
        return length >= fenceLength && text.substring(length).isBlank();
    }

    void blank(int lineIndent) {
        lines.add(" ".repeat(Math.max(0, lineIndent - indent)));
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        Attr attr = language.isEmpty() ? Attr.empty() : Attr.withClass(language);
        return new CodeBlock(attr, String.join("\n", lines));
    }
}
