package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-field scores for a document and the overall score the router consumes.
 * The overall score is the mean over non-empty fields only.
 */
@Value
public class DocumentConfidence {
    double overallScore;
    ConfidenceLevel level;
    Map<String, FieldConfidence> fieldScores;
    int totalFields;
    int highConfidenceFields;
    int mediumConfidenceFields;
    int lowConfidenceFields;
    int minScore;
    int maxScore;

    @Builder
    private DocumentConfidence(double overallScore, ConfidenceLevel level,
                               Map<String, FieldConfidence> fieldScores, int totalFields,
                               int highConfidenceFields, int mediumConfidenceFields,
                               int lowConfidenceFields, int minScore, int maxScore) {
        if (Double.isNaN(overallScore) || overallScore < 0.0 || overallScore > 100.0) {
            throw new IllegalArgumentException("Overall confidence out of range: " + overallScore);
        }
        this.overallScore = overallScore;
        this.level = level;
        this.fieldScores = fieldScores == null ? Map.of() : fieldScores;
        this.totalFields = totalFields;
        this.highConfidenceFields = highConfidenceFields;
        this.mediumConfidenceFields = mediumConfidenceFields;
        this.lowConfidenceFields = lowConfidenceFields;
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    /**
     * Score of a field, 0 when the field is empty or was not scored.
     */
    public int scoreOf(String fieldName) {
        FieldConfidence field = fieldScores.get(fieldName);
        return field == null ? 0 : field.getScore();
    }

    public boolean isEmpty(String fieldName) {
        FieldConfidence field = fieldScores.get(fieldName);
        return field == null || field.isEmpty();
    }
}
