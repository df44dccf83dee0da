package com.elementcatalog.sync;

import com.elementcatalog.model.Catalog;

import java.util.List;

/**
 * Outcome of {@link CatalogSyncer#loadCatalog}.
 *
 * @param source   which file the catalog came from
 * @param warnings non-empty whenever the primary manifest was not used as is
 */
public record LoadResult(Catalog catalog, Source source, List<String> warnings) {

    public enum Source { PRIMARY, BACKUP, EMPTY }

    public LoadResult {
        warnings = List.copyOf(warnings);
    }
}
