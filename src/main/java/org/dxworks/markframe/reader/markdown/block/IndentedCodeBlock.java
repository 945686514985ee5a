package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.CodeBlock;
import org.dxworks.markframe.reader.markdown.inline.InlineParser;

import java.util.ArrayList;
import java.util.List;

final class IndentedCodeBlock extends OpenBlock {

    static final int CODE_INDENT = 4;

    private final List<String> lines = new ArrayList<>();
    // blank lines are only kept once a later code line follows them
    private final List<String> pendingBlanks = new ArrayList<>();

    IndentedCodeBlock(Line line) {
        lines.add(line.withoutIndent(CODE_INDENT).content());
    }

    @Override
    public Kind kind() {
        return Kind.INDENTED_CODE;
    }

    Transition next(Line line, BlockStarts starts) {
        if (line.indent() >= CODE_INDENT) {
            lines.addAll(pendingBlanks);
            pendingBlanks.clear();
            lines.add(line.withoutIndent(CODE_INDENT).content());
            return Transition.UNCHANGED;
        }
        return starts.closeAndStart(line);
    }

    void blank(int indent) {
        pendingBlanks.add(" ".repeat(Math.max(0, indent - CODE_INDENT)));
    }

    @Override
    public Block toBlock(InlineParser inlines) {
        return new CodeBlock(Attr.empty(), String.join("\n", lines));
    }
}
