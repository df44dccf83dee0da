package com.elementcatalog.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Scope selector used by queries. {@code ALL} never appears on stored entries.
 */
public enum ScopeFilter {

    ALL, GLOBAL, PROJECT, LOCAL;

    public boolean matches(Scope scope) {
        return this == ALL || name().equals(scope.name());
    }

    /** Scopes selected by this filter, in global, project, local order. */
    public Set<Scope> scopes() {
        return this == ALL ? EnumSet.allOf(Scope.class) : EnumSet.of(Scope.valueOf(name()));
    }

    public static ScopeFilter of(Scope scope) {
        return valueOf(scope.name());
    }

    public static ScopeFilter parse(String value) {
        if (value == null || value.isBlank()) return ALL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CatalogValidationException("Unknown scope filter: '" + value + "'", e);
        }
    }
}
