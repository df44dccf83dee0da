package com.elementcatalog.service;

import com.elementcatalog.model.ElementType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of {@link CatalogManager#syncCatalogs}.
 *
 * @param reports per-type counts for the types that synced successfully
 * @param failed  types whose sync failed; their error is among the warnings
 * @param warnings skipped files, degraded loads and per-type failures, in order
 */
public record SyncResult(Map<ElementType, TypeSyncReport> reports,
                         Set<ElementType> failed,
                         List<String> warnings) {

    public SyncResult {
        Map<ElementType, TypeSyncReport> ordered = new EnumMap<>(ElementType.class);
        ordered.putAll(reports);
        reports  = Collections.unmodifiableMap(ordered);
        Set<ElementType> failedTypes = EnumSet.noneOf(ElementType.class);
        failedTypes.addAll(failed);
        failed   = Collections.unmodifiableSet(failedTypes);
        warnings = List.copyOf(warnings);
    }

    public boolean succeeded() {
        return failed.isEmpty();
    }

    public int total() {
        return reports.values().stream().mapToInt(TypeSyncReport::total).sum();
    }
}
