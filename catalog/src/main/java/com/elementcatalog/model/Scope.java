package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Layer an element is installed at.
 *
 * Precedence follows the configuration rule local &gt; project &gt; global:
 * a lower number wins when the same name exists in several scopes.
 */
public enum Scope {

    GLOBAL(3),
    PROJECT(2),
    LOCAL(1);

    private final int precedence;

    Scope(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() { return precedence; }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Scope fromKey(String key) {
        if (key != null) {
            for (Scope scope : values()) {
                if (scope.key().equalsIgnoreCase(key.trim())) {
                    return scope;
                }
            }
        }
        throw new CatalogValidationException("Unknown scope: '" + key + "'");
    }
}
