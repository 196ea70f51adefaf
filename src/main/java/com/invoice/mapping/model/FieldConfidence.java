package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A field's blended confidence with the breakdown shown to reviewers.
 * Empty fields score 0 and carry no breakdown.
 */
@Value
public class FieldConfidence {
    String fieldName;
    int score;
    ConfidenceLevel level;
    boolean empty;
    List<FactorContribution> breakdown;

    @Builder
    private FieldConfidence(String fieldName, int score, ConfidenceLevel level, boolean empty,
                            @Singular("contribution") List<FactorContribution> breakdown) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Field confidence out of range for '" + fieldName + "': " + score);
        }
        this.fieldName = fieldName;
        this.score = score;
        this.level = level;
        this.empty = empty;
        this.breakdown = breakdown;
    }

    public static FieldConfidence empty(String fieldName) {
        return FieldConfidence.builder()
                .fieldName(fieldName)
                .score(0)
                .level(ConfidenceLevel.LOW)
                .empty(true)
                .build();
    }
}
