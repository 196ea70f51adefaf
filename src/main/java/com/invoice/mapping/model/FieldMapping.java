package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Value;

/**
 * The outcome of mapping one standardized field of one document. Immutable
 * once produced; reviewer corrections are recorded elsewhere.
 *
 * An empty mapping carries no value. An invalid mapping still carries its
 * value, flagged for the reviewer.
 */
@Value
public class FieldMapping {

    public static final String NO_MATCHING_RULE = "no matching rule found";

    String fieldName;
    String rawValue;
    String value;
    Integer sourcePage;
    String sourceText;
    BoundingBox position;
    int confidence;
    ExtractionMethod method;
    Long ruleId;
    boolean valid;
    String validationError;
    boolean empty;
    String emptyReason;

    @Builder
    private FieldMapping(String fieldName, String rawValue, String value, Integer sourcePage,
                         String sourceText, BoundingBox position, int confidence,
                         ExtractionMethod method, Long ruleId, boolean valid,
                         String validationError, boolean empty, String emptyReason) {
        if (empty && value != null) {
            throw new IllegalArgumentException("Empty mapping for '" + fieldName + "' cannot carry a value");
        }
        if (!empty && value == null) {
            throw new IllegalArgumentException("Non-empty mapping for '" + fieldName + "' needs a value");
        }
        if (empty && !valid) {
            throw new IllegalArgumentException("Empty mapping for '" + fieldName + "' cannot be invalid");
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence out of range for '" + fieldName + "': " + confidence);
        }
        this.fieldName = fieldName;
        this.rawValue = rawValue;
        this.value = value;
        this.sourcePage = sourcePage;
        this.sourceText = sourceText;
        this.position = position;
        this.confidence = confidence;
        this.method = method == null ? ExtractionMethod.NONE : method;
        this.ruleId = ruleId;
        this.valid = valid;
        this.validationError = validationError;
        this.empty = empty;
        this.emptyReason = emptyReason;
    }

    public static FieldMapping empty(String fieldName, String reason) {
        return FieldMapping.builder()
                .fieldName(fieldName)
                .method(ExtractionMethod.NONE)
                .confidence(0)
                .valid(true)
                .empty(true)
                .emptyReason(reason)
                .build();
    }
}
