package com.elementcatalog.service;

import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;

import java.util.Map;

/**
 * Entry counts over the persisted catalogs.
 */
public record CatalogStats(int total, Map<ElementType, Integer> byType, Map<Scope, Integer> byScope) {

    public CatalogStats {
        byType  = Map.copyOf(byType);
        byScope = Map.copyOf(byScope);
    }
}
