package org.dxworks.markframe.reader;

/**
 * Raised when source text cannot be turned into a document.
 */
public class DocumentReadException extends Exception {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
