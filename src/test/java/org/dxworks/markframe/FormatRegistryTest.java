package org.dxworks.markframe;

import org.dxworks.markframe.model.block.Para;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.reader.DocumentReader;
import org.dxworks.markframe.reader.NativeReader;
import org.dxworks.markframe.writer.DocumentWriter;
import org.dxworks.markframe.writer.LatexWriter;
import org.dxworks.markframe.writer.NativeWriter;
import org.dxworks.markframe.writer.TypstWriter;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FormatRegistryTest {

    @Test
    void detectFormat_byExtension() {
        assertEquals(Optional.of(Format.MARKDOWN), FormatRegistry.detectFormat(Paths.get("docs/README.MD")));
        assertEquals(Optional.of(Format.MARKDOWN), FormatRegistry.detectFormat(Paths.get("notes.markdown")));
        assertEquals(Optional.of(Format.NATIVE), FormatRegistry.detectFormat(Paths.get("doc.json")));
        assertEquals(Optional.of(Format.TYPST), FormatRegistry.detectFormat(Paths.get("doc.typ")));
        assertEquals(Optional.empty(), FormatRegistry.detectFormat(Paths.get("image.png")));
    }

    @Test
    void isMarkdown() {
        assertTrue(FormatRegistry.isMarkdown(Paths.get("a.md")));
        assertFalse(FormatRegistry.isMarkdown(Paths.get("a.json")));
    }

    @Test
    void allFormatNames() {
        assertEquals(Set.of("markdown", "native", "typst", "latex"), FormatRegistry.allFormatNames());
    }

    @Test
    void byName_ignoresCase() {
        assertEquals(Optional.of(Format.LATEX), Format.byName("LaTeX"));
        assertEquals(Optional.empty(), Format.byName("html"));
    }

    @Test
    void writers_existForEveryOutputFormat() {
        Map<Format, Supplier<DocumentWriter>> writers = FormatRegistry.buildWriters();

        assertFalse(writers.containsKey(Format.MARKDOWN));
        assertInstanceOf(NativeWriter.class, writers.get(Format.NATIVE).get());
        assertInstanceOf(TypstWriter.class, writers.get(Format.TYPST).get());
        assertInstanceOf(LatexWriter.class, writers.get(Format.LATEX).get());
        assertNotSame(writers.get(Format.TYPST).get(), writers.get(Format.TYPST).get());
    }

    @Test
    void readers_followTableSetting() throws Exception {
        String source = "| a |\n| --- |\n| 1 |";

        Map<Format, DocumentReader> withTables = FormatRegistry.buildReaders(MarkframeConfig.defaults());
        Map<Format, DocumentReader> withoutTables = FormatRegistry.buildReaders(
                MarkframeConfig.with(100, Format.NATIVE, false));

        assertInstanceOf(Table.class, withTables.get(Format.MARKDOWN).read(source).blocks.get(0));
        assertInstanceOf(Para.class, withoutTables.get(Format.MARKDOWN).read(source).blocks.get(0));
        assertInstanceOf(NativeReader.class, withTables.get(Format.NATIVE));
    }
}
