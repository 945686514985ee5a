package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Document;

public interface DocumentWriter {
    String write(Document document) throws UnsupportedConstructException;
}
