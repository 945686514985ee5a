package org.dxworks.markframe;

import org.dxworks.markframe.reader.NativeReader;
import org.dxworks.markframe.reader.markdown.MarkdownReader;
import org.dxworks.markframe.writer.TypstWriter;
import org.dxworks.markframe.writer.UnsupportedConstructException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void run_withTooFewArguments_isUsageError() {
        assertEquals(2, App.run(new String[]{"only-input"}));
    }

    @Test
    void run_withUnknownOrInputOnlyFormat_isUsageError() throws Exception {
        Path input = Files.writeString(tempDir.resolve("a.md"), "# a\n");

        assertEquals(2, App.run(new String[]{input.toString(), tempDir.resolve("out").toString(), "docx"}));
        assertEquals(2, App.run(new String[]{input.toString(), tempDir.resolve("out").toString(), "markdown"}));
    }

    @Test
    void run_withMissingInput_fails() {
        assertEquals(1, App.run(new String[]{tempDir.resolve("missing.md").toString(), tempDir.resolve("o").toString()}));
    }

    @Test
    void run_convertsSingleFile() throws Exception {
        Path input = Files.writeString(tempDir.resolve("doc.md"), "\uFEFF# Title\n\nSome *text*.\n");
        Path output = tempDir.resolve("doc.typ");

        assertEquals(0, App.run(new String[]{input.toString(), output.toString(), "typst"}));
        assertEquals("= Title\n\nSome _text_.\n", Files.readString(output));
    }

    @Test
    void run_convertsFolderOfMarkdownFiles() throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input.resolve("sub"));
        Files.writeString(input.resolve("a.md"), "a\n");
        Files.writeString(input.resolve("sub/b.markdown"), "- b\n");
        Files.writeString(input.resolve("notes.txt"), "not markdown\n");
        Path output = tempDir.resolve("out");

        assertEquals(0, App.run(new String[]{input.toString(), output.toString(), "latex"}));

        assertTrue(Files.readString(output.resolve("a.tex")).contains("\\begin{document}\na\n\\end{document}"));
        assertTrue(Files.readString(output.resolve("sub/b.tex")).contains("\\item b"));
        assertFalse(Files.exists(output.resolve("notes.tex")));
    }

    @Test
    void run_reportsFilesThatCannotBeWritten() throws Exception {
        Path input = Files.writeString(tempDir.resolve("doc.json"),
                "{\"meta\": {}, \"blocks\": [{\"t\": \"Div\", \"attr\": {}, \"blocks\": []}]}");

        assertEquals(1, App.run(new String[]{input.toString(), tempDir.resolve("doc.typ").toString(), "typst"}));
        assertFalse(Files.exists(tempDir.resolve("doc.typ")));
    }

    @Test
    void collectSourceFiles_skipsFilesOverTheLineLimit() throws Exception {
        Files.writeString(tempDir.resolve("short.md"), "a\nb\n");
        Files.writeString(tempDir.resolve("long.md"), "a\nb\nc\nd\n");

        assertEquals(List.of(tempDir.resolve("short.md")), App.collectSourceFiles(tempDir, 3));
    }

    @Test
    void outputPathFor_mirrorsInputTree() {
        Path result = App.outputPathFor(Paths.get("in"), Paths.get("in/docs/guide.v2.md"), Paths.get("out"), Format.NATIVE);

        assertEquals(Paths.get("out/docs/guide.v2.json"), result);
    }

    @Test
    void convert_nativeToTypst() throws Exception {
        String json = new org.dxworks.markframe.writer.NativeWriter().write(new MarkdownReader().read("**bold**"));

        assertEquals("*bold*\n", App.convert(json, new NativeReader(), new TypstWriter()));
    }

    @Test
    void convert_unsupportedConstruct_propagates() {
        String json = "{\"meta\": {}, \"blocks\": [{\"t\": \"LineBlock\", \"lines\": []}]}";

        assertThrows(UnsupportedConstructException.class, () -> App.convert(json, new NativeReader(), new TypstWriter()));
    }
}
