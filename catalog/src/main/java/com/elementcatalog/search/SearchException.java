package com.elementcatalog.search;

import com.elementcatalog.CatalogException;

/**
 * Malformed search input.
 */
public class SearchException extends CatalogException {

    public SearchException(String message) {
        super(Kind.SEARCH, message);
    }
}
