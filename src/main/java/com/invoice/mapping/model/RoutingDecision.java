package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The routing outcome for one document. Recomputing from the same confidence,
 * document age and clock yields an equal decision.
 */
@Value
@Builder
public class RoutingDecision {

    public static final String SYSTEM = "system";

    ProcessingPath path;
    String reason;
    double confidence;
    List<String> lowConfidenceFields;
    List<String> criticalFieldsAffected;
    int priority;
    Instant decidedAt;
    @Builder.Default
    String decidedBy = SYSTEM;

    public boolean requiresReview() {
        return path != ProcessingPath.AUTO_APPROVE;
    }
}
