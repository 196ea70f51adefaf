package com.invoice.mapping.model;

/**
 * The four signals blended into a field's confidence.
 */
public enum ConfidenceFactor {
    OCR_CONFIDENCE,
    RULE_MATCH,
    FORMAT_VALIDATION,
    HISTORICAL_ACCURACY
}
