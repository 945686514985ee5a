package org.dxworks.markframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.reader.markdown.MarkdownReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class TestUtils {
    public static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static Document read(String markdown) {
        return new MarkdownReader().read(markdown);
    }

    public static String sample(String fileName) throws IOException {
        return Files.readString(Paths.get(SAMPLES_BASE_PATH + fileName), StandardCharsets.UTF_8);
    }
}
