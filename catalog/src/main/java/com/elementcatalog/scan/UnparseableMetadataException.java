package com.elementcatalog.scan;

/**
 * A candidate file carries no metadata header that can be read as a
 * key/value mapping. Recovered by the scanner: the file is skipped.
 */
public class UnparseableMetadataException extends RuntimeException {

    public UnparseableMetadataException(String message) {
        super(message);
    }

    public UnparseableMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
