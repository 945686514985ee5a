package org.dxworks.markframe.reader.markdown.inline;

/**
 * A link reference definition such as {@code [label]: /url "title"}, with destination and title
 * already unescaped.
 */
public class LinkReference {
    public final String label;
    public final String destination;
    public final String title;

    public LinkReference(String label, String destination, String title) {
        this.label = label;
        this.destination = destination;
        this.title = title == null ? "" : title;
    }

    @Override
    public String toString() {
        return "[" + label + "]: " + destination + (title.isEmpty() ? "" : " \"" + title + "\"");
    }
}
