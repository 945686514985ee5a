package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.reader.markdown.MarkdownOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-driven block structure recognizer. Holds at most one open block; block quotes and list
 * items own a nested parser for their content.
 */
public final class BlockParser {

    private final BlockStarts starts;
    private final List<OpenBlock> finished = new ArrayList<>();
    private OpenBlock current = EmptyBlock.INSTANCE;

    public BlockParser(MarkdownOptions options) {
        this(new BlockStarts(options));
    }

    BlockParser(BlockStarts starts) {
        this.starts = starts;
    }

    /**
     * Offers one line to the open block.
     *
     * @return whether the line began a new block at this level
     */
    public boolean feed(Line line) {
        if (line.isBlank()) {
            feedBlank(line.indent());
            return false;
        }
        Transition transition = switch (current.kind()) {
            case EMPTY -> starts.start(line);
            case PARAGRAPH -> ((Paragraph) current).next(line);
            case INDENTED_CODE -> ((IndentedCodeBlock) current).next(line, starts);
            case FENCED_CODE -> ((FencedCodeBlock) current).next(line);
            case TABLE -> ((TableBlock) current).next(line);
            case BLOCK_QUOTE -> ((BlockQuote) current).next(line);
            case LIST -> ((ListBlock) current).next(line);
            case ATX_HEADING, THEMATIC_BREAK -> throw new IllegalStateException(current.kind() + " never stays open");
        };
        return apply(transition);
    }

    /**
     * Offers a blank line with {@code indent} columns of whitespace.
     *
     * @return whether the blank line separates blocks, which it does not inside fenced code
     */
    public boolean feedBlank(int indent) {
        switch (current.kind()) {
            case EMPTY:
                return true;
            case INDENTED_CODE:
                ((IndentedCodeBlock) current).blank(indent);
                return true;
            case FENCED_CODE:
                ((FencedCodeBlock) current).blank(indent);
                return false;
            case LIST:
                return ((ListBlock) current).blank(indent);
            default:
                apply(Transition.FINISHED);
                return true;
        }
    }

    /**
     * Appends {@code line} to the innermost open paragraph when it does not open a block itself.
     */
    boolean tryLazyContinuation(Line line) {
        return switch (current.kind()) {
            case PARAGRAPH -> ((Paragraph) current).tryLazy(line);
            case BLOCK_QUOTE -> ((BlockQuote) current).tryLazyContinuation(line);
            case LIST -> ((ListBlock) current).tryLazyContinuation(line);
            default -> false;
        };
    }

    public boolean isEmpty() {
        return current == EmptyBlock.INSTANCE && finished.isEmpty();
    }

    /**
     * Closes the open block and returns every block in document order.
     */
    public List<OpenBlock> finish() {
        closeCurrent();
        return finished;
    }

    private boolean apply(Transition transition) {
        switch (transition.type()) {
            case UNCHANGED:
                return false;
            case REPLACED:
                boolean fresh = current == EmptyBlock.INSTANCE;
                current = transition.block();
                return fresh;
            case FINISHED:
                closeCurrent();
                return false;
            case EMITTED:
                finished.add(transition.block());
                return true;
            case FINISHED_AND_REPLACED:
                closeCurrent();
                current = transition.block();
                return true;
            case FINISHED_AND_EMITTED:
                closeCurrent();
                finished.add(transition.block());
                return true;
            default:
                throw new IllegalStateException("Unknown transition " + transition.type());
        }
    }

    private void closeCurrent() {
        if (current != EmptyBlock.INSTANCE) {
            current.close();
            finished.add(current);
            current = EmptyBlock.INSTANCE;
        }
    }
}
