package com.elementcatalog.sync;

import com.elementcatalog.model.CatalogEntry;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link CatalogSyncer#mergeEntries}.
 *
 * @param entries       merged entries: persisted order first, new entries after
 * @param added         discovered entries with no persisted counterpart
 * @param updated       persisted entries rediscovered at the same scope and path
 * @param retained      persisted entries not seen by the scan, kept unchanged
 * @param nameConflicts "scope:name" keys occurring more than once, with their count
 */
public record MergeResult(
        List<CatalogEntry>   entries,
        int                  added,
        int                  updated,
        int                  retained,
        Map<String, Integer> nameConflicts) {

    public MergeResult {
        entries       = List.copyOf(entries);
        nameConflicts = Map.copyOf(nameConflicts);
    }
}
