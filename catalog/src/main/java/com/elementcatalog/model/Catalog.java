package com.elementcatalog.model;

import java.time.Instant;
import java.util.List;

/**
 * The persisted manifest of one element type.
 *
 * Each type's catalog is saved on its own; there is no transaction spanning
 * several catalogs.
 *
 * @param schemaVersion manifest format version, {@link #SCHEMA_VERSION} when written by this code
 * @param lastSynced    when the catalog was last reconciled with the filesystem
 * @param elementType   the only type allowed in {@code entries}
 * @param entries       entries in manifest order
 */
public record Catalog(
        String              schemaVersion,
        Instant             lastSynced,
        ElementType         elementType,
        List<CatalogEntry>  entries) {

    public static final String SCHEMA_VERSION = "1.0";

    public Catalog {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            throw new CatalogValidationException("schema_version is required");
        }
        if (lastSynced == null) throw new CatalogValidationException("last_synced is required");
        if (elementType == null) throw new CatalogValidationException("element type is required");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /** A freshly initialized catalog with no entries. */
    public static Catalog empty(ElementType type) {
        return new Catalog(SCHEMA_VERSION, Instant.EPOCH, type, List.of());
    }

    public Catalog withEntries(List<? extends CatalogEntry> newEntries, Instant syncedAt) {
        return new Catalog(SCHEMA_VERSION, syncedAt, elementType, List.copyOf(newEntries));
    }

    public int size() { return entries.size(); }
}
