package org.dxworks.markframe.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.reader.NativeJson;

/**
 * Writes the document tree as JSON: {@code {"meta": {...}, "blocks": [...]}} with every element
 * tagged by a {@code "t"} property.
 */
public class NativeWriter implements DocumentWriter {

    private final ObjectMapper mapper;

    public NativeWriter() {
        this(false);
    }

    public NativeWriter(boolean pretty) {
        ObjectMapper base = NativeJson.mapper();
        this.mapper = pretty ? base.enable(SerializationFeature.INDENT_OUTPUT) : base;
    }

    @Override
    public String write(Document document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }
}
