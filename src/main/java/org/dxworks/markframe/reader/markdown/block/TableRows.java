package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.model.Alignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitting of pipe table rows into cells.
 */
final class TableRows {

    private TableRows() {
    }

    /**
     * Splits a row on unescaped pipes after dropping one leading and one trailing pipe. An escaped
     * pipe {@code \|} becomes a literal pipe inside the cell; every cell is trimmed.
     */
    static List<String> split(String row) {
        String text = row.strip();
        if (text.startsWith("|")) {
            text = text.substring(1);
        }
        if (text.endsWith("|") && !isEscaped(text, text.length() - 1)) {
            text = text.substring(0, text.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (c == '|') {
                cells.add(cell.toString().strip());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().strip());
        return cells;
    }

    /**
     * Parses a delimiter row such as {@code | :--- | :-: |} or {@code :-} into one alignment per
     * column, or {@code null} when the row is not a delimiter row. Pipes are optional.
     */
    static List<Alignment> parseDelimiterRow(String row) {
        String text = row.strip();
        List<Alignment> alignments = new ArrayList<>();
        for (String cell : split(text)) {
            Alignment alignment = parseDelimiterCell(cell);
            if (alignment == null) {
                return null;
            }
            alignments.add(alignment);
        }
        return alignments;
    }

    private static Alignment parseDelimiterCell(String cell) {
        if (cell.isEmpty()) {
            return null;
        }
        boolean left = cell.charAt(0) == ':';
        boolean right = cell.length() > 1 && cell.charAt(cell.length() - 1) == ':';
        int start = left ? 1 : 0;
        int end = right ? cell.length() - 1 : cell.length();
        if (start >= end) {
            return null;
        }
        for (int i = start; i < end; i++) {
            if (cell.charAt(i) != '-') {
                return null;
            }
        }
        return Alignment.fromColons(left, right);
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
