package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SkillTemplate {

    BASIC, ANALYSIS, IMPLEMENTATION, VALIDATION;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SkillTemplate fromKey(String key) {
        if (key != null) {
            for (SkillTemplate t : values()) {
                if (t.key().equalsIgnoreCase(key.trim())) return t;
            }
        }
        throw new CatalogValidationException("Unknown skill template: '" + key + "'");
    }
}
