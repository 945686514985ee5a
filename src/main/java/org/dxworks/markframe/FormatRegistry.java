package org.dxworks.markframe;

import org.dxworks.markframe.reader.DocumentReader;
import org.dxworks.markframe.reader.NativeReader;
import org.dxworks.markframe.reader.markdown.MarkdownOptions;
import org.dxworks.markframe.reader.markdown.MarkdownReader;
import org.dxworks.markframe.writer.DocumentWriter;
import org.dxworks.markframe.writer.LatexWriter;
import org.dxworks.markframe.writer.NativeWriter;
import org.dxworks.markframe.writer.TypstWriter;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class FormatRegistry {

    public static Optional<Format> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString();
        for (Format format : Format.values()) {
            if (format.matchesFileName(fileName)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static boolean isMarkdown(Path filePath) {
        return detectFormat(filePath).filter(format -> format == Format.MARKDOWN).isPresent();
    }

    public static Set<String> allFormatNames() {
        return Arrays.stream(Format.values())
            .map(Format::getName)
            .collect(Collectors.toSet());
    }

    public static Map<Format, DocumentReader> buildReaders(MarkframeConfig config) {
        Map<Format, DocumentReader> readers = new EnumMap<>(Format.class);
        readers.put(Format.MARKDOWN, new MarkdownReader(MarkdownOptions.with(config.isTables())));
        readers.put(Format.NATIVE, new NativeReader());
        return Collections.unmodifiableMap(readers);
    }

    /**
     * Writers keep per-document state, so callers get a factory and create one writer per document.
     */
    public static Map<Format, Supplier<DocumentWriter>> buildWriters() {
        Map<Format, Supplier<DocumentWriter>> writers = new EnumMap<>(Format.class);
        for (Format format : Format.values()) {
            createWriter(format).ifPresent(factory -> writers.put(format, factory));
        }
        return Collections.unmodifiableMap(writers);
    }

    private static Optional<Supplier<DocumentWriter>> createWriter(Format format) {
        return switch (format) {
            case NATIVE -> Optional.of(NativeWriter::new);
            case TYPST -> Optional.of(TypstWriter::new);
            case LATEX -> Optional.of(LatexWriter::new);
            case MARKDOWN -> Optional.empty();
        };
    }
}
