package org.dxworks.markframe.reader.markdown.inline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Link reference definitions of one document, keyed by normalized label. The first definition of
 * a label wins.
 */
public final class LinkReferences {

    public static final int MAX_LABEL_LENGTH = 999;

    private final Map<String, LinkReference> definitions = new LinkedHashMap<>();

    public void add(LinkReference reference) {
        definitions.putIfAbsent(normalize(reference.label), reference);
    }

    public LinkReference get(String label) {
        if (label.length() > MAX_LABEL_LENGTH) {
            return null;
        }
        return definitions.get(normalize(label));
    }

    public int size() {
        return definitions.size();
    }

    public Map<String, LinkReference> asMap() {
        return Collections.unmodifiableMap(definitions);
    }

    /**
     * Trims, collapses inner whitespace runs to one space and case-folds.
     */
    public static String normalize(String label) {
        String collapsed = label.strip().replaceAll("\\s+", " ");
        return collapsed.toLowerCase(Locale.ROOT).toUpperCase(Locale.ROOT);
    }
}
