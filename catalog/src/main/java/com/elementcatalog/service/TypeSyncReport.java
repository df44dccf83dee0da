package com.elementcatalog.service;

import com.elementcatalog.model.ElementType;

/**
 * Counts for one element type after a sync.
 *
 * @param discovered entries found by the scan
 * @param added      new entries
 * @param updated    persisted entries reconfirmed by the scan
 * @param retained   persisted entries the scan did not see
 * @param total      entries in the saved catalog
 * @param cached     true when the type was served from the cache and not rescanned
 */
public record TypeSyncReport(
        ElementType type,
        int         discovered,
        int         added,
        int         updated,
        int         retained,
        int         total,
        boolean     cached) {

    static TypeSyncReport fromCache(ElementType type, int total) {
        return new TypeSyncReport(type, 0, 0, 0, 0, total, true);
    }
}
