package com.invoice.mapping.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a field value was obtained. {@link #NONE} marks an empty mapping.
 */
public enum ExtractionMethod {
    PRETRAINED,
    REGEX,
    KEYWORD,
    POSITION,
    DEFAULT,
    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
