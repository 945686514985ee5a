package org.dxworks.markframe.reader.markdown.inline;

import org.dxworks.markframe.model.Attr;
import org.dxworks.markframe.model.Target;
import org.dxworks.markframe.model.inline.Code;
import org.dxworks.markframe.model.inline.Emph;
import org.dxworks.markframe.model.inline.Image;
import org.dxworks.markframe.model.inline.Inline;
import org.dxworks.markframe.model.inline.LineBreak;
import org.dxworks.markframe.model.inline.Link;
import org.dxworks.markframe.model.inline.SoftBreak;
import org.dxworks.markframe.model.inline.Str;
import org.dxworks.markframe.model.inline.Strikeout;
import org.dxworks.markframe.model.inline.Strong;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of a paragraph, heading or table cell into inlines.
 * <p>
 * The text is scanned left to right into a linked list of nodes. Runs of {@code *}, {@code _} and
 * {@code ~} are pushed on a delimiter stack and brackets on a bracket stack; a closing bracket
 * resolves a link or image and emphasis inside it, and the rest of the emphasis is resolved at the
 * end. Instances are reusable but not thread-safe.
 */
public final class InlineParser {

    private static final String SPECIALS = "\n\\`*_~[]!&<";
    private static final Pattern URI_AUTOLINK = Pattern.compile("<([A-Za-z][A-Za-z0-9.+-]{1,31}:[^<>\\x00-\\x20]*)>");
    private static final Pattern EMAIL_AUTOLINK = Pattern.compile(
            "<([a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*)>");
    private static final int MAX_STRIKEOUT_RUN = 2;

    private final LinkReferences references;

    private String input;
    private int pos;
    private InlineNodes nodes;
    private Delimiter lastDelimiter;
    private final List<Bracket> brackets = new ArrayList<>();

    public InlineParser(LinkReferences references) {
        this.references = references;
    }

    public List<Inline> parse(String text) {
        input = text.stripTrailing();
        pos = 0;
        nodes = new InlineNodes();
        lastDelimiter = null;
        brackets.clear();
        while (pos < input.length()) {
            parseNext();
        }
        processEmphasis(null);
        return InlineNodes.flatten(nodes.first(), null);
    }

    private void parseNext() {
        char c = input.charAt(pos);
        switch (c) {
            case '\n' -> parseNewline();
            case '\\' -> parseBackslash();
            case '`' -> parseBackticks();
            case '*', '_', '~' -> parseDelimiterRun(c);
            case '[' -> {
                InlineNode node = nodes.appendText("[", true);
                pos++;
                brackets.add(new Bracket(node, false, pos, lastDelimiter));
            }
            case '!' -> parseBang();
            case ']' -> parseCloseBracket();
            case '&' -> parseEntity();
            case '<' -> parseAutolink();
            default -> parseText();
        }
    }

    private void parseText() {
        int start = pos;
        pos++;
        while (pos < input.length() && SPECIALS.indexOf(input.charAt(pos)) < 0) {
            pos++;
        }
        nodes.appendText(input.substring(start, pos), false);
    }

    private void parseNewline() {
        pos++;
        int spaces = nodes.trimTrailingWhitespace();
        nodes.appendInline(spaces >= 2 ? new LineBreak() : new SoftBreak());
        pos = LinkSyntax.skipSpaces(input, pos);
    }

    private void parseBackslash() {
        pos++;
        if (pos < input.length() && input.charAt(pos) == '\n') {
            nodes.appendInline(new LineBreak());
            pos = LinkSyntax.skipSpaces(input, pos + 1);
        } else if (pos < input.length() && InlineText.isAsciiPunctuation(input.charAt(pos))) {
            nodes.appendText(String.valueOf(input.charAt(pos)), false);
            pos++;
        } else {
            nodes.appendText("\\", false);
        }
    }

    private void parseBackticks() {
        int start = pos;
        int length = runLength(start, '`');
        int after = start + length;
        int search = after;
        while (true) {
            int close = input.indexOf('`', search);
            if (close < 0) {
                break;
            }
            int closeLength = runLength(close, '`');
            if (closeLength == length) {
                nodes.appendInline(new Code(codeSpanText(input.substring(after, close))));
                pos = close + closeLength;
                return;
            }
            search = close + closeLength;
        }
        nodes.appendText(input.substring(start, after), false);
        pos = after;
    }

    private static String codeSpanText(String raw) {
        String text = raw.replace('\n', ' ');
        if (text.length() >= 2 && text.startsWith(" ") && text.endsWith(" ") && !text.chars().allMatch(c -> c == ' ')) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private int runLength(int start, char c) {
        int i = start;
        while (i < input.length() && input.charAt(i) == c) {
            i++;
        }
        return i - start;
    }

    private void parseDelimiterRun(char c) {
        int start = pos;
        int length = runLength(start, c);
        pos += length;
        String run = input.substring(start, pos);
        if (c == '~' && length > MAX_STRIKEOUT_RUN) {
            nodes.appendText(run, false);
            return;
        }

        int before = start == 0 ? '\n' : input.codePointBefore(start);
        int after = pos >= input.length() ? '\n' : input.codePointAt(pos);
        boolean beforeWhitespace = InlineText.isWhitespace(before);
        boolean afterWhitespace = InlineText.isWhitespace(after);
        boolean beforePunctuation = InlineText.isPunctuation(before);
        boolean afterPunctuation = InlineText.isPunctuation(after);
        boolean leftFlanking = !afterWhitespace && (!afterPunctuation || beforeWhitespace || beforePunctuation);
        boolean rightFlanking = !beforeWhitespace && (!beforePunctuation || afterWhitespace || afterPunctuation);

        boolean canOpen;
        boolean canClose;
        if (c == '_') {
            canOpen = leftFlanking && (!rightFlanking || beforePunctuation);
            canClose = rightFlanking && (!leftFlanking || afterPunctuation);
        } else {
            canOpen = leftFlanking;
            canClose = rightFlanking;
        }

        InlineNode node = nodes.appendText(run, true);
        if (canOpen || canClose) {
            Delimiter delimiter = new Delimiter(node, c, length, canOpen, canClose);
            delimiter.prev = lastDelimiter;
            if (lastDelimiter != null) {
                lastDelimiter.next = delimiter;
            }
            lastDelimiter = delimiter;
        }
    }

    private void parseBang() {
        if (pos + 1 < input.length() && input.charAt(pos + 1) == '[') {
            InlineNode node = nodes.appendText("![", true);
            pos += 2;
            brackets.add(new Bracket(node, true, pos, lastDelimiter));
        } else {
            nodes.appendText("!", false);
            pos++;
        }
    }

    private void parseEntity() {
        EntityDecoder.Match match = EntityDecoder.match(input, pos);
        if (match == null) {
            nodes.appendText("&", false);
            pos++;
            return;
        }
        nodes.appendText(match.value, false);
        pos = match.end;
    }

    private void parseAutolink() {
        Matcher uri = URI_AUTOLINK.matcher(input).region(pos, input.length());
        if (uri.lookingAt()) {
            String url = uri.group(1);
            nodes.appendInline(autolink(url, url, "uri"));
            pos = uri.end();
            return;
        }
        Matcher email = EMAIL_AUTOLINK.matcher(input).region(pos, input.length());
        if (email.lookingAt()) {
            String address = email.group(1);
            nodes.appendInline(autolink(address, "mailto:" + address, "email"));
            pos = email.end();
            return;
        }
        nodes.appendText("<", false);
        pos++;
    }

    private static Link autolink(String text, String url, String className) {
        Link link = new Link(new ArrayList<>(List.of(new Str(text))), new Target(url, ""));
        link.attr = Attr.withClass(className);
        return link;
    }

    private void parseCloseBracket() {
        int closePos = pos;
        pos++;
        if (brackets.isEmpty()) {
            nodes.appendText("]", false);
            return;
        }
        Bracket opener = brackets.get(brackets.size() - 1);
        if (!opener.active) {
            brackets.remove(brackets.size() - 1);
            nodes.appendText("]", false);
            return;
        }

        Target target = inlineLinkTarget();
        if (target == null) {
            target = referenceTarget(opener, closePos);
        }
        brackets.remove(brackets.size() - 1);
        if (target == null) {
            nodes.appendText("]", false);
            return;
        }

        processEmphasis(opener.previousDelimiter);
        List<Inline> content = InlineNodes.flatten(opener.node.next, null);
        nodes.truncateAt(opener.node);
        nodes.appendInline(opener.image ? new Image(content, target) : new Link(content, target));
        if (!opener.image) {
            // no links inside links
            for (Bracket bracket : brackets) {
                if (!bracket.image) {
                    bracket.active = false;
                }
            }
        }
    }

    /**
     * Parses {@code (destination "title")} right after the closing bracket, advancing past it on success.
     */
    private Target inlineLinkTarget() {
        if (pos >= input.length() || input.charAt(pos) != '(') {
            return null;
        }
        int i = skipWhitespace(pos + 1);
        String destination = "";
        String title = "";
        if (i < input.length() && input.charAt(i) != ')') {
            int destinationEnd = LinkSyntax.scanDestination(input, i);
            if (destinationEnd < 0) {
                return null;
            }
            destination = LinkSyntax.destination(input, i, destinationEnd);
            i = skipWhitespace(destinationEnd);
            if (i > destinationEnd) {
                int titleEnd = LinkSyntax.scanTitle(input, i);
                if (titleEnd >= 0) {
                    title = LinkSyntax.title(input, i, titleEnd);
                    i = skipWhitespace(titleEnd);
                }
            }
        }
        if (i >= input.length() || input.charAt(i) != ')') {
            return null;
        }
        pos = i + 1;
        return new Target(destination, title);
    }

    /**
     * Resolves a full {@code [text][label]}, collapsed {@code [text][]} or shortcut {@code [text]}
     * reference, advancing past a consumed label on success.
     */
    private Target referenceTarget(Bracket opener, int closePos) {
        String label;
        int labelEnd = LinkSyntax.scanLabel(input, pos);
        if (labelEnd > pos + 2) {
            label = input.substring(pos + 1, labelEnd - 1);
        } else {
            label = input.substring(opener.textStart, closePos);
        }
        if (label.isBlank()) {
            return null;
        }
        LinkReference reference = references.get(label);
        if (reference == null) {
            return null;
        }
        if (labelEnd >= 0) {
            pos = labelEnd;
        }
        return new Target(reference.destination, reference.title);
    }

    private int skipWhitespace(int start) {
        int i = start;
        while (i < input.length() && InlineText.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Matches closers with openers above {@code stackBottom}, innermost first, then drops every
     * delimiter above it.
     */
    private void processEmphasis(Delimiter stackBottom) {
        Map<String, Delimiter> openersBottom = new HashMap<>();

        Delimiter closer = firstAbove(stackBottom);
        while (closer != null) {
            if (!closer.canClose) {
                closer = closer.next;
                continue;
            }
            String key = closer.character == '~'
                    ? "~" + closer.length
                    : closer.character + ":" + closer.canOpen + ":" + closer.originalLength % 3;
            Delimiter bottom = openersBottom.getOrDefault(key, stackBottom);

            Delimiter opener = closer.prev;
            while (opener != null && opener != stackBottom && opener != bottom) {
                if (opener.character == closer.character && opener.canOpen && compatible(opener, closer)) {
                    break;
                }
                opener = opener.prev;
            }

            if (opener == null || opener == stackBottom || opener == bottom) {
                openersBottom.put(key, closer.prev);
                Delimiter next = closer.next;
                if (!closer.canOpen) {
                    removeDelimiter(closer);
                }
                closer = next;
                continue;
            }

            int used = closer.character == '~' ? closer.length
                    : opener.length >= 2 && closer.length >= 2 ? 2 : 1;
            opener.length -= used;
            closer.length -= used;
            opener.node.text.setLength(opener.node.text.length() - used);
            closer.node.text.delete(0, used);

            List<Inline> content = InlineNodes.flatten(opener.node.next, closer.node);
            Inline wrapped;
            if (closer.character == '~') {
                wrapped = new Strikeout(content);
            } else if (used == 2) {
                wrapped = new Strong(content);
            } else {
                wrapped = new Emph(content);
            }
            nodes.replaceBetween(opener.node, closer.node, wrapped);

            Delimiter between = closer.prev;
            while (between != opener) {
                Delimiter previous = between.prev;
                removeDelimiter(between);
                between = previous;
            }
            if (opener.length == 0) {
                nodes.remove(opener.node);
                removeDelimiter(opener);
            }
            if (closer.length == 0) {
                Delimiter next = closer.next;
                nodes.remove(closer.node);
                removeDelimiter(closer);
                closer = next;
            }
        }

        while (lastDelimiter != null && lastDelimiter != stackBottom) {
            removeDelimiter(lastDelimiter);
        }
    }

    private Delimiter firstAbove(Delimiter stackBottom) {
        if (lastDelimiter == stackBottom) {
            return null;
        }
        Delimiter delimiter = lastDelimiter;
        while (delimiter != null && delimiter.prev != stackBottom) {
            delimiter = delimiter.prev;
        }
        return delimiter;
    }

    // strikethrough pairs runs of equal length; emphasis follows the rule of three
    private static boolean compatible(Delimiter opener, Delimiter closer) {
        if (closer.character == '~') {
            return opener.length == closer.length;
        }
        if (!opener.canClose && !closer.canOpen) {
            return true;
        }
        int sum = opener.originalLength + closer.originalLength;
        return sum % 3 != 0 || opener.originalLength % 3 == 0 && closer.originalLength % 3 == 0;
    }

    private void removeDelimiter(Delimiter delimiter) {
        if (delimiter.prev != null) {
            delimiter.prev.next = delimiter.next;
        }
        if (delimiter.next != null) {
            delimiter.next.prev = delimiter.prev;
        } else {
            lastDelimiter = delimiter.prev;
        }
        delimiter.prev = null;
        delimiter.next = null;
    }
}
