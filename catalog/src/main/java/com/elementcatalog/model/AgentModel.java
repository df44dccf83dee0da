package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Model an agent runs on.
 *
 * Agent headers name either the family ("sonnet") or a full model
 * identifier ("claude-3-5-sonnet-20241022"); both resolve to the family.
 * {@code INHERIT} means the agent uses whatever model its caller runs.
 */
public enum AgentModel {

    HAIKU, SONNET, OPUS, INHERIT;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentModel fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new CatalogValidationException("Agent model must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (AgentModel m : values()) {
            if (m.key().equals(v)) return m;
        }
        if (v.startsWith("claude-")) {
            for (AgentModel m : values()) {
                if (m != INHERIT && v.contains("-" + m.key())) return m;
            }
        }
        throw new CatalogValidationException("Unknown agent model: '" + value + "'");
    }
}
