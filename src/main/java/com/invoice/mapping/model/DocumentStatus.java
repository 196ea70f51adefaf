package com.invoice.mapping.model;

/**
 * Status the parent document takes once routing has run.
 */
public enum DocumentStatus {
    COMPLETED,
    PENDING_REVIEW
}
