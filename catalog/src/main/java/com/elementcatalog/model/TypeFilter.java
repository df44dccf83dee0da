package com.elementcatalog.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Element-type selector used by queries. {@code ALL} is reserved for filters.
 */
public enum TypeFilter {

    ALL, SKILL, COMMAND, AGENT;

    public boolean matches(ElementType type) {
        return this == ALL || name().equals(type.name());
    }

    public Set<ElementType> types() {
        return this == ALL ? EnumSet.allOf(ElementType.class) : EnumSet.of(ElementType.valueOf(name()));
    }

    public static TypeFilter of(ElementType type) {
        return valueOf(type.name());
    }

    /** Accepts "all", singular or plural type keys, case-insensitive. */
    public static TypeFilter parse(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return ALL;
        }
        return of(ElementType.fromKey(value));
    }
}
