package com.elementcatalog.sync;

import com.elementcatalog.model.Catalog;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CatalogValidationException;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Catalog-level schema checks. Field constraints of single entries are
 * enforced when the entry records are constructed, so a catalog that
 * deserialized at all only needs the cross-entry rules checked here.
 */
public class CatalogValidator {

    public static final Set<String> SUPPORTED_VERSIONS = Set.of(Catalog.SCHEMA_VERSION);

    /**
     * @throws CatalogValidationException on an unsupported schema version, an entry of
     *         another element type or a duplicate id
     */
    public void validate(Catalog catalog) {
        if (!SUPPORTED_VERSIONS.contains(catalog.schemaVersion())) {
            throw new CatalogValidationException(
                    "Unsupported schema_version '" + catalog.schemaVersion() + "'");
        }
        Set<UUID> ids = new HashSet<>();
        for (CatalogEntry entry : catalog.entries()) {
            if (entry.elementType() != catalog.elementType()) {
                throw new CatalogValidationException(
                        "Entry '" + entry.name() + "' is a " + entry.elementType().key()
                        + " in the " + catalog.elementType().plural() + " catalog");
            }
            if (!ids.add(entry.id())) {
                throw new CatalogValidationException("Duplicate entry id " + entry.id());
            }
        }
    }
}
