package com.elementcatalog.sync;

import com.elementcatalog.CatalogException;

/**
 * The backup copy of a manifest could not be made; the write does not start.
 */
public class CatalogBackupException extends CatalogException {

    public CatalogBackupException(String message) {
        super(Kind.BACKUP, message);
    }

    public CatalogBackupException(String message, Throwable cause) {
        super(Kind.BACKUP, message, cause);
    }
}
