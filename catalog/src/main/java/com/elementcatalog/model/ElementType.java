package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of the catalog entry variants.
 *
 * The plural form doubles as the scope sub-directory the elements live in
 * and as the entry-list key of the manifest file.
 */
public enum ElementType {

    SKILL("skill", "skills"),
    COMMAND("command", "commands"),
    AGENT("agent", "agents");

    private final String key;
    private final String plural;

    ElementType(String key, String plural) {
        this.key    = key;
        this.plural = plural;
    }

    @JsonValue
    public String key() { return key; }

    public String plural() { return plural; }

    /** Accepts the singular or plural key, case-insensitive. */
    @JsonCreator
    public static ElementType fromKey(String value) {
        if (value != null) {
            String v = value.trim();
            for (ElementType type : values()) {
                if (type.key.equalsIgnoreCase(v) || type.plural.equalsIgnoreCase(v)) {
                    return type;
                }
            }
        }
        throw new CatalogValidationException("Unknown element type: '" + value + "'");
    }
}
