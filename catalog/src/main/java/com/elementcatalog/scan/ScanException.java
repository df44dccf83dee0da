package com.elementcatalog.scan;

import com.elementcatalog.CatalogException;

/**
 * A whole scan cannot proceed, e.g. a scope root exists but cannot be read.
 * Problems with individual files are warnings, never this exception.
 */
public class ScanException extends CatalogException {

    public ScanException(String message) {
        super(Kind.SCAN, message);
    }

    public ScanException(String message, Throwable cause) {
        super(Kind.SCAN, message, cause);
    }
}
