package org.dxworks.markframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkframeConfigTest {

    @TempDir
    Path tempDir;

    private MarkframeConfig load(String yaml) throws IOException {
        Path config = tempDir.resolve("markframe-config.yml");
        Files.writeString(config, yaml);
        return MarkframeConfig.load(config);
    }

    @Test
    void missingFile_usesDefaults() {
        MarkframeConfig config = MarkframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Format.NATIVE, config.getOutputFormat());
        assertTrue(config.isTables());
    }

    @Test
    void allSettingsAreRead() throws IOException {
        MarkframeConfig config = load("maxFileLines: 50\noutputFormat: Typst\ntables: false\n");

        assertEquals(50, config.getMaxFileLines());
        assertEquals(Format.TYPST, config.getOutputFormat());
        assertFalse(config.isTables());
    }

    @Test
    void missingSettings_fallBackIndividually() throws IOException {
        MarkframeConfig config = load("outputFormat: latex\n");

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Format.LATEX, config.getOutputFormat());
        assertTrue(config.isTables());
    }

    @Test
    void invalidValues_fallBackToDefaults() throws IOException {
        MarkframeConfig config = load("maxFileLines: -3\noutputFormat: markdown\n");

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Format.NATIVE, config.getOutputFormat());
        assertEquals(Format.NATIVE, load("outputFormat: docx\n").getOutputFormat());
    }

    @Test
    void unreadableFile_usesDefaults() throws IOException {
        MarkframeConfig config = load("maxFileLines: [not, a, number\n");

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Format.NATIVE, config.getOutputFormat());
    }

    @Test
    void with_replacesNonPositiveLineLimit() {
        assertEquals(20000, MarkframeConfig.with(0, Format.TYPST, true).getMaxFileLines());
        assertEquals(7, MarkframeConfig.with(7, Format.TYPST, true).getMaxFileLines());
    }
}
