package org.dxworks.markframe.reader;

import org.dxworks.markframe.model.Document;

public interface DocumentReader {
    Document read(String source) throws DocumentReadException;
}
