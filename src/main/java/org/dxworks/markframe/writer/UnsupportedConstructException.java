package org.dxworks.markframe.writer;

/**
 * Raised by a writer for a block or inline variant it has no rendering for.
 */
public class UnsupportedConstructException extends Exception {

    private final String construct;

    public UnsupportedConstructException(String construct, String format) {
        super(construct + " is not supported by the " + format + " writer");
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
