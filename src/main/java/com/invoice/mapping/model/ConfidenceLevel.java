package com.invoice.mapping.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceLevel of(double score, double highThreshold, double mediumThreshold) {
        if (score >= highThreshold) return HIGH;
        if (score >= mediumThreshold) return MEDIUM;
        return LOW;
    }
}
