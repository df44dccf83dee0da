package com.elementcatalog.sync;

import com.elementcatalog.CatalogException;
import com.elementcatalog.model.ElementType;

/**
 * Neither the manifest nor its backup could be loaded. Never thrown out of
 * {@link CatalogSyncer#loadCatalog}: the load degrades to an empty catalog and
 * the message becomes a warning.
 */
public class CatalogLoadException extends CatalogException {

    private final ElementType elementType;

    public CatalogLoadException(ElementType elementType, String message, Throwable cause) {
        super(Kind.LOAD, message, cause);
        this.elementType = elementType;
    }

    public ElementType getElementType() { return elementType; }
}
