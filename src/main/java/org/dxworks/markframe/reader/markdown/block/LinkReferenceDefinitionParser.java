package org.dxworks.markframe.reader.markdown.block;

import org.dxworks.markframe.reader.markdown.inline.LinkReference;
import org.dxworks.markframe.reader.markdown.inline.LinkSyntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the link reference definitions that open a paragraph:
 * {@code [label]: destination "optional title"}, each ending its line.
 */
final class LinkReferenceDefinitionParser {

    static final class Result {
        private final List<LinkReference> definitions;
        private final String remainder;

        Result(List<LinkReference> definitions, String remainder) {
            this.definitions = definitions;
            this.remainder = remainder;
        }

        List<LinkReference> definitions() {
            return definitions;
        }

        /** Paragraph text left after the definitions. */
        String remainder() {
            return remainder;
        }
    }

    private LinkReferenceDefinitionParser() {
    }

    static Result parse(String content) {
        List<LinkReference> definitions = new ArrayList<>();
        int pos = 0;
        while (pos < content.length()) {
            int end = parseDefinition(content, pos, definitions);
            if (end < 0) {
                break;
            }
            pos = end;
        }
        return new Result(definitions, content.substring(pos));
    }

    /**
     * @return the index after the definition's line ending, or -1 when no definition starts at {@code start}
     */
    private static int parseDefinition(String text, int start, List<LinkReference> definitions) {
        int labelEnd = LinkSyntax.scanLabel(text, start);
        if (labelEnd < 0) {
            return -1;
        }
        String label = text.substring(start + 1, labelEnd - 1);
        if (label.isBlank() || labelEnd >= text.length() || text.charAt(labelEnd) != ':') {
            return -1;
        }

        int destinationStart = LinkSyntax.skipSpacesAndNewline(text, labelEnd + 1);
        int destinationEnd = LinkSyntax.scanDestination(text, destinationStart);
        if (destinationEnd < 0) {
            return -1;
        }
        String destination = LinkSyntax.destination(text, destinationStart, destinationEnd);

        int afterDestination = LinkSyntax.skipSpaces(text, destinationEnd);
        int titleStart = LinkSyntax.skipSpacesAndNewline(text, destinationEnd);
        if (titleStart > destinationEnd) {
            int titleEnd = LinkSyntax.scanTitle(text, titleStart);
            if (titleEnd >= 0) {
                int lineEnd = LinkSyntax.skipSpaces(text, titleEnd);
                if (isLineEnd(text, lineEnd)) {
                    definitions.add(new LinkReference(label, destination, LinkSyntax.title(text, titleStart, titleEnd)));
                    return nextLine(text, lineEnd);
                }
            }
        }
        // a title that does not end its line leaves the definition without one
        if (isLineEnd(text, afterDestination)) {
            definitions.add(new LinkReference(label, destination, ""));
            return nextLine(text, afterDestination);
        }
        return -1;
    }

    private static boolean isLineEnd(String text, int index) {
        return index >= text.length() || text.charAt(index) == '\n';
    }

    private static int nextLine(String text, int lineEnd) {
        return lineEnd >= text.length() ? text.length() : lineEnd + 1;
    }
}
