package com.elementcatalog.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Field constraints shared by the entry records' compact constructors.
 */
final class EntryChecks {

    static final int MAX_NAME_LENGTH        = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private EntryChecks() {}

    static UUID id(UUID id) {
        if (id == null) throw new CatalogValidationException("Entry id is required");
        return id;
    }

    /** Skill and agent names: trimmed, 1-100 chars, no '/'. */
    static String plainName(String name) {
        String n = requireText("name", name, MAX_NAME_LENGTH);
        if (n.contains("/")) {
            throw new CatalogValidationException("Name must not contain '/': '" + n + "'");
        }
        return n;
    }

    /** Command names always start with a single '/'; the 100-char limit includes it. */
    static String commandName(String name) {
        String n = requireText("name", name, Integer.MAX_VALUE);
        if (!n.startsWith("/")) n = "/" + n;
        if (n.length() < 2 || n.charAt(1) == '/') {
            throw new CatalogValidationException("Invalid command name: '" + name + "'");
        }
        if (n.length() > MAX_NAME_LENGTH) {
            throw new CatalogValidationException(
                    "name exceeds " + MAX_NAME_LENGTH + " characters (" + n.length() + ")");
        }
        return n;
    }

    static String description(String description) {
        return requireText("description", description, MAX_DESCRIPTION_LENGTH);
    }

    static Scope scope(Scope scope) {
        if (scope == null) throw new CatalogValidationException("Entry scope is required");
        return scope;
    }

    static Path path(Path path) {
        if (path == null) throw new CatalogValidationException("Entry path is required");
        if (!path.isAbsolute()) {
            throw new CatalogValidationException("Entry path must be absolute: " + path);
        }
        return path.normalize();
    }

    static void timestamps(Instant createdAt, Instant updatedAt) {
        if (createdAt == null || updatedAt == null) {
            throw new CatalogValidationException("created_at and updated_at are required");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new CatalogValidationException(
                    "updated_at " + updatedAt + " is before created_at " + createdAt);
        }
    }

    static Map<String, Object> metadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static List<String> strings(String field, List<String> values) {
        if (values == null) return List.of();
        for (String v : values) {
            if (v == null || v.isBlank()) {
                throw new CatalogValidationException(field + " must not contain blank values");
            }
        }
        return List.copyOf(values);
    }

    private static String requireText(String field, String value, int max) {
        if (value == null || value.isBlank()) {
            throw new CatalogValidationException(field + " must not be blank");
        }
        String v = value.strip();
        if (v.length() > max) {
            throw new CatalogValidationException(
                    field + " exceeds " + max + " characters (" + v.length() + ")");
        }
        return v;
    }
}
