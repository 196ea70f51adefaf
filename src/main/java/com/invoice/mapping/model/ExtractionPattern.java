package com.invoice.mapping.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How a mapping rule locates its value in the OCR output. Stored as JSON on
 * the rule, discriminated by the {@code method} property.
 *
 * The hierarchy is closed; callers dispatch through {@link Visitor} so that a
 * new variant fails to compile until every consumer handles it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "method")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RegexPattern.class, name = "regex"),
        @JsonSubTypes.Type(value = KeywordPattern.class, name = "keyword"),
        @JsonSubTypes.Type(value = PositionPattern.class, name = "position"),
        @JsonSubTypes.Type(value = PretrainedFieldPattern.class, name = "pretrained")
})
public sealed interface ExtractionPattern
        permits RegexPattern, KeywordPattern, PositionPattern, PretrainedFieldPattern {

    @JsonIgnore
    ExtractionMethod method();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitRegex(RegexPattern pattern);

        R visitKeyword(KeywordPattern pattern);

        R visitPosition(PositionPattern pattern);

        R visitPretrained(PretrainedFieldPattern pattern);
    }
}
