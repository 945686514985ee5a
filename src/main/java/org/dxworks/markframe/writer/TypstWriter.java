package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.TableRow;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a document as Typst markup. Nested emphasis of the same kind is flattened, since Typst
 * toggles {@code _} and {@code *} instead of nesting them. Not thread-safe.
 */
public class TypstWriter extends MarkupWriter {

    private static final String SPECIAL_CHARACTERS = "\\*_`$#<>@[]~/";
    private static final int MIN_FENCE = 3;

    private boolean inEmph;
    private boolean inStrong;

    @Override
    protected String formatName() {
        return "Typst";
    }

    @Override
    protected String document(String body) {
        return body.isEmpty() ? "" : body + "\n";
    }

    @Override
    protected String paragraph(List<Inline> content) throws UnsupportedConstructException {
        String text = inlines(content);
        // a leading list or heading marker would change the block type
        if (!text.isEmpty() && "-+=".indexOf(text.charAt(0)) >= 0) {
            return "\\" + text;
        }
        return text;
    }

    @Override
    protected String heading(int level, List<Inline> content) throws UnsupportedConstructException {
        return "=".repeat(level) + " " + inlines(content);
    }

    @Override
    protected String thematicBreak() {
        return "#line(length: 100%)";
    }

    @Override
    protected String codeBlock(String language, String text) {
        String fence = "`".repeat(Math.max(MIN_FENCE, longestRun(text, '`') + 1));
        return fence + language + "\n" + text + "\n" + fence;
    }

    @Override
    protected String blockQuote(List<Block> blocks) throws UnsupportedConstructException {
        return "#quote(block: true)[\n" + blocks(blocks) + "\n]";
    }

    @Override
    protected String bulletList(List<List<Block>> items, boolean tight) throws UnsupportedConstructException {
        List<String> rendered = new ArrayList<>();
        for (List<Block> item : items) {
            rendered.add("- " + indentFollowingLines(item(item, tight), "  "));
        }
        return String.join(tight ? "\n" : "\n\n", rendered);
    }

    @Override
    protected String orderedList(int start, List<List<Block>> items, boolean tight)
            throws UnsupportedConstructException {
        List<String> rendered = new ArrayList<>();
        int number = start;
        for (List<Block> item : items) {
            String marker = number + ". ";
            rendered.add(marker + indentFollowingLines(item(item, tight), " ".repeat(marker.length())));
            number++;
        }
        return String.join(tight ? "\n" : "\n\n", rendered);
    }

    @Override
    protected String table(Table table) throws UnsupportedConstructException {
        List<String> alignments = new ArrayList<>();
        for (Alignment alignment : table.alignments()) {
            alignments.add(alignment(alignment));
        }
        StringBuilder result = new StringBuilder("#table(\n");
        result.append("  columns: ").append(table.columns.size()).append(",\n");
        result.append("  align: (").append(String.join(", ", alignments));
        if (alignments.size() == 1) {
            result.append(',');
        }
        result.append("),\n");
        List<TableRow> rows = new ArrayList<>(table.head);
        rows.addAll(table.body);
        rows.addAll(table.foot);
        for (TableRow row : rows) {
            List<String> cells = new ArrayList<>();
            for (TableCell cell : row.cells) {
                cells.add("[" + inlines(cellContent(cell)) + "]");
            }
            result.append("  ").append(String.join(", ", cells)).append(",\n");
        }
        return result.append(')').toString();
    }

    private static String alignment(Alignment alignment) {
        return switch (alignment) {
            case LEFT -> "left";
            case RIGHT -> "right";
            case CENTER -> "center";
            case DEFAULT -> "auto";
        };
    }

    @Override
    protected String escape(String text) {
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
                result.append('\\');
            }
            result.append(c);
        }
        return result.toString();
    }

    @Override
    protected String lineBreak() {
        return "\\\n";
    }

    @Override
    protected String emph(List<Inline> content) throws UnsupportedConstructException {
        if (inEmph) {
            return inlines(content);
        }
        inEmph = true;
        try {
            return "_" + inlines(content) + "_";
        } finally {
            inEmph = false;
        }
    }

    @Override
    protected String strong(List<Inline> content) throws UnsupportedConstructException {
        if (inStrong) {
            return inlines(content);
        }
        inStrong = true;
        try {
            return "*" + inlines(content) + "*";
        } finally {
            inStrong = false;
        }
    }

    @Override
    protected String strikeout(List<Inline> content) throws UnsupportedConstructException {
        return "#strike[" + inlines(content) + "]";
    }

    @Override
    protected String code(String text) {
        return "#raw(" + quote(text) + ")";
    }

    @Override
    protected String link(String url, List<Inline> content) throws UnsupportedConstructException {
        return "#link(" + quote(url) + ")[" + inlines(content) + "]";
    }

    @Override
    protected String image(String url, List<Inline> description) {
        return "#image(" + quote(url) + ")";
    }

    private static String quote(String text) {
        StringBuilder result = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"' -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                default -> result.append(c);
            }
        }
        return result.append('"').toString();
    }

    private static int longestRun(String text, char c) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
