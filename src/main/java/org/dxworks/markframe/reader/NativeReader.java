package org.dxworks.markframe.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.markframe.model.Document;

/**
 * Reads the JSON form written by {@link org.dxworks.markframe.writer.NativeWriter}.
 */
public class NativeReader implements DocumentReader {

    private static final ObjectMapper MAPPER = NativeJson.mapper();

    @Override
    public Document read(String source) throws DocumentReadException {
        try {
            Document document = MAPPER.readValue(source, Document.class);
            if (document == null) {
                throw new DocumentReadException("Empty native document");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new DocumentReadException("Malformed native document: " + e.getOriginalMessage(), e);
        }
    }
}
