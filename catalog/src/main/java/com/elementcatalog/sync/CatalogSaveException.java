package com.elementcatalog.sync;

import com.elementcatalog.CatalogException;

/**
 * The atomic write failed before the rename. The manifest on disk is the one
 * that was there before the attempt; a {@code .backup} copy may remain next to it.
 */
public class CatalogSaveException extends CatalogException {

    public CatalogSaveException(String message, Throwable cause) {
        super(Kind.SAVE, message, cause);
    }
}
