package org.dxworks.markframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MarkframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "markframe-config.yml";
    private static final Format DEFAULT_OUTPUT_FORMAT = Format.NATIVE;
    private static final boolean DEFAULT_TABLES = true;

    private final int maxFileLines;
    private final Format outputFormat;
    private final boolean tables;

    private MarkframeConfig(int maxFileLines, Format outputFormat, boolean tables) {
        this.maxFileLines = maxFileLines;
        this.outputFormat = outputFormat;
        this.tables = tables;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public Format getOutputFormat() {
        return outputFormat;
    }

    public boolean isTables() {
        return tables;
    }

    public static MarkframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MarkframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxFileLines = yamlConfig.maxFileLines;
                String outputFormat = yamlConfig.outputFormat;
                Boolean tables = yamlConfig.tables;

                int effectiveMaxFileLines = (maxFileLines != null && maxFileLines > 0)
                        ? maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                Format effectiveOutputFormat = outputFormat != null
                        ? Format.byName(outputFormat).filter(format -> format != Format.MARKDOWN).orElse(DEFAULT_OUTPUT_FORMAT)
                        : DEFAULT_OUTPUT_FORMAT;
                boolean effectiveTables = tables != null ? tables : DEFAULT_TABLES;

                return new MarkframeConfig(effectiveMaxFileLines, effectiveOutputFormat, effectiveTables);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static MarkframeConfig defaults() {
        return new MarkframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_OUTPUT_FORMAT, DEFAULT_TABLES);
    }

    public static MarkframeConfig with(int maxFileLines, Format outputFormat, boolean tables) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new MarkframeConfig(effectiveMaxFileLines, outputFormat, tables);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String outputFormat;
        public Boolean tables;
    }
}
