package com.invoice.mapping.model;

public enum ProcessingPath {
    AUTO_APPROVE,
    QUICK_REVIEW,
    FULL_REVIEW,
    MANUAL_REQUIRED
}
