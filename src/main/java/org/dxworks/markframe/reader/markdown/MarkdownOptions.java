package org.dxworks.markframe.reader.markdown;

/**
 * Switches for the optional GitHub extensions of the Markdown reader.
 */
public final class MarkdownOptions {

    private static final MarkdownOptions DEFAULTS = new MarkdownOptions(true);

    private final boolean tables;

    private MarkdownOptions(boolean tables) {
        this.tables = tables;
    }

    public static MarkdownOptions defaults() {
        return DEFAULTS;
    }

    public static MarkdownOptions with(boolean tables) {
        return new MarkdownOptions(tables);
    }

    public boolean isTables() {
        return tables;
    }
}
