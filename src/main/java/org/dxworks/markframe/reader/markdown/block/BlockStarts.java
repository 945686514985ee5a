package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.reader.markdown.MarkdownOptions;

/**
 * Recognizes which block a line opens, by its first non-blank character.
 */
final class BlockStarts {

    private final MarkdownOptions options;

    BlockStarts(MarkdownOptions options) {
        this.options = options;
    }

    MarkdownOptions options() {
        return options;
    }

    /**
     * The block {@code line} opens, or {@code null} when it is plain paragraph text.
     *
     * @param interrupting the line follows paragraph text, so indented code and lists that are
     *                     empty or start at a number other than one are not recognized
     */
    OpenBlock open(Line line, boolean interrupting) {
        if (line.indent() >= IndentedCodeBlock.CODE_INDENT) {
            return interrupting ? null : new IndentedCodeBlock(line);
        }
        char c = line.first();
        return switch (c) {
            case '#' -> AtxHeading.tryParse(line);
            case '_' -> ThematicBreak.matches(line) ? ThematicBreak.INSTANCE : null;
            case '`', '~' -> FencedCodeBlock.tryOpen(line);
            case '>' -> new BlockQuote(line, this);
            case '*', '-' -> ThematicBreak.matches(line)
                    ? ThematicBreak.INSTANCE
                    : ListBlock.tryOpen(line, interrupting, this);
            case '+', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> ListBlock.tryOpen(line, interrupting, this);
            default -> null;
        };
    }

    /**
     * Starts whatever {@code line} opens on a fresh, empty parser.
     */
    Transition start(Line line) {
        OpenBlock block = open(line, false);
        if (block == null) {
            return Transition.replaced(new Paragraph(line, this));
        }
        return isSingleLine(block) ? Transition.emitted(block) : Transition.replaced(block);
    }

    /**
     * Ends the open block and starts whatever {@code line} opens.
     */
    Transition closeAndStart(Line line) {
        OpenBlock block = open(line, false);
        if (block == null) {
            return Transition.finishedAndReplaced(new Paragraph(line, this));
        }
        return isSingleLine(block) ? Transition.finishedAndEmitted(block) : Transition.finishedAndReplaced(block);
    }

    static boolean isSingleLine(OpenBlock block) {
        return block.kind() == OpenBlock.Kind.ATX_HEADING || block.kind() == OpenBlock.Kind.THEMATIC_BREAK;
    }
}
