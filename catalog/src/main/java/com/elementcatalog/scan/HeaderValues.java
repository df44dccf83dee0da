package com.elementcatalog.scan;

import com.elementcatalog.model.CatalogValidationException;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed reads from a parsed metadata header. Header keys come in kebab-case
 * or snake_case depending on who wrote the file, so every lookup accepts
 * several spellings.
 */
final class HeaderValues {

    private HeaderValues() {}

    static Optional<String> string(Map<String, Object> header, String... keys) {
        Object value = first(header, keys);
        if (value == null) return Optional.empty();
        if (value instanceof Map || value instanceof Collection) {
            throw new CatalogValidationException("'" + keys[0] + "' must be a scalar value");
        }
        String s = value.toString().strip();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    /** A YAML list of scalars, or a single comma-separated string. */
    static List<String> strings(Map<String, Object> header, String... keys) {
        Object value = first(header, keys);
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item == null) continue;
                if (item instanceof Map || item instanceof Collection) {
                    throw new CatalogValidationException("'" + keys[0] + "' must be a list of strings");
                }
                String s = item.toString().strip();
                if (!s.isEmpty()) out.add(s);
            }
        } else if (value instanceof Map) {
            throw new CatalogValidationException("'" + keys[0] + "' must be a list of strings");
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) out.add(part.strip());
            }
        }
        return out;
    }

    /** Header keys not in {@code consumed}, converted to JSON-friendly values. */
    static Map<String, Object> remaining(Map<String, Object> header, Set<String> consumed) {
        Map<String, Object> rest = new LinkedHashMap<>();
        header.forEach((k, v) -> {
            if (!consumed.contains(k)) rest.put(k, plain(v));
        });
        return rest;
    }

    static Object plain(Object value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC).toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), plain(v)));
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>();
            for (Object item : items) out.add(plain(item));
            return out;
        }
        return value.toString();
    }

    private static Object first(Map<String, Object> header, String... keys) {
        for (String key : keys) {
            Object v = header.get(key);
            if (v != null) return v;
        }
        return null;
    }
}
