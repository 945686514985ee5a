package org.dxworks.markframe;

import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.reader.DocumentReadException;
import org.dxworks.markframe.reader.DocumentReader;
import org.dxworks.markframe.writer.DocumentWriter;
import org.dxworks.markframe.writer.UnsupportedConstructException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

public class App {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            printUsage();
            return 2;
        }

        MarkframeConfig config = MarkframeConfig.load();
        Format target = config.getOutputFormat();
        if (args.length > 2) {
            Optional<Format> requested = Format.byName(args[2]).filter(format -> format != Format.MARKDOWN);
            if (requested.isEmpty()) {
                System.err.println("Error: Unknown output format: " + args[2]);
                printUsage();
                return 2;
            }
            target = requested.get();
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }
        Path output = Paths.get(args[1]);

        System.out.println("Starting conversion to " + target.getName() + "...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files;
        try {
            files = collectSourceFiles(input, config.getMaxFileLines());
        } catch (IOException e) {
            System.err.println("Error: Cannot list " + input + ": " + e.getMessage());
            return 1;
        }
        System.out.println("Found " + files.size() + " source files");

        Map<Format, DocumentReader> readers = FormatRegistry.buildReaders(config);
        Supplier<DocumentWriter> writerFactory = FormatRegistry.buildWriters().get(target);
        boolean folder = Files.isDirectory(input);
        Format outputFormat = target;

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        files.parallelStream().forEach(file -> {
            Format format = FormatRegistry.detectFormat(file).orElse(Format.MARKDOWN);
            DocumentReader reader = readers.get(format);
            int current = progressCounter.incrementAndGet();

            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
            }

            try {
                if (reader == null) {
                    throw new IllegalArgumentException("No reader available for: " + format.getName());
                }
                Path destination = folder ? outputPathFor(input, file, output, outputFormat) : output;
                convertFile(file, destination, reader, writerFactory.get());
                successCount.incrementAndGet();
            } catch (Exception e) {
                errorCount.incrementAndGet();
                synchronized (System.err) {
                    System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });

        Instant endTime = Instant.now();
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete in " + Duration.between(startTime, endTime).toMillis() + " ms");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
        return errorCount.get() > 0 ? 1 : 0;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar markframe.jar <input> <output> [format]");
        System.err.println("  <input>:  Markdown file, native JSON file, or folder of Markdown files");
        System.err.println("  <output>: Output file, or output folder when <input> is a folder");
        System.err.println("  [format]: One of native, typst, latex (default from markframe-config.yml, else native)");
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(FormatRegistry::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | java.io.UncheckedIOException e) {
            return true;
        }
    }

    /**
     * Mirrors {@code file}'s place under {@code inputRoot} below {@code outputRoot}, with the
     * extension of {@code format}.
     */
    static Path outputPathFor(Path inputRoot, Path file, Path outputRoot, Format format) {
        Path relative = inputRoot.relativize(file);
        String fileName = relative.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputRoot.resolve(relative).resolveSibling(baseName + format.getExtension());
    }

    public static void convertFile(Path input, Path output, DocumentReader reader, DocumentWriter writer)
            throws IOException, DocumentReadException, UnsupportedConstructException {
        String source = Files.readString(input, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        String result = convert(source, reader, writer);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, result, StandardCharsets.UTF_8);
    }

    public static String convert(String source, DocumentReader reader, DocumentWriter writer)
            throws DocumentReadException, UnsupportedConstructException {
        Document document = reader.read(source);
        return writer.write(document);
    }
}
