package com.elementcatalog.search;

import com.elementcatalog.model.CatalogEntry;

/**
 * A search hit. {@code score} is 0 for queries without text.
 */
public record ScoredEntry(CatalogEntry entry, int score) {}
