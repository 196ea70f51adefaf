package com.invoice.mapping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Preprocessor {
    NONE,
    TRIM,
    UPPERCASE,
    LOWERCASE;

    public String apply(String value) {
        if (value == null) return null;
        return switch (this) {
            case NONE -> value;
            case TRIM -> value.trim();
            case UPPERCASE -> value.toUpperCase(Locale.ROOT);
            case LOWERCASE -> value.toLowerCase(Locale.ROOT);
        };
    }

    // Unknown names are a no-op rather than a rule error
    @JsonCreator
    public static Preprocessor from(String name) {
        if (name == null || name.isBlank()) return NONE;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
