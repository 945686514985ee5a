package org.dxworks.markframe;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Format {
    MARKDOWN("markdown", List.of(".md", ".markdown")),
    NATIVE("native", List.of(".json")),
    TYPST("typst", List.of(".typ")),
    LATEX("latex", List.of(".tex"));

    private final String name;
    private final List<String> extensions;

    Format(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    /**
     * The extension files written in this format get.
     */
    public String getExtension() {
        return extensions.get(0);
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<Format> byName(String name) {
        for (Format format : values()) {
            if (format.name.equalsIgnoreCase(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
