package com.elementcatalog.model;

import com.elementcatalog.CatalogException;

/**
 * A single entry, or a whole catalog, violates its schema.
 */
public class CatalogValidationException extends CatalogException {

    public CatalogValidationException(String message) {
        super(Kind.VALIDATION, message);
    }

    public CatalogValidationException(String message, Throwable cause) {
        super(Kind.VALIDATION, message, cause);
    }
}
