package com.elementcatalog.scan;

import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.ElementType;

import java.util.List;

/**
 * Entries found by one scan plus one warning per skipped file or directory.
 */
public record ScanResult(ElementType type, List<CatalogEntry> entries, List<String> warnings) {

    public ScanResult {
        entries  = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public int skipped() { return warnings.size(); }
}
