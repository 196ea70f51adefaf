package com.invoice.mapping.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review backlog states. PENDING moves to IN_PROGRESS on assignment and
 * IN_PROGRESS to COMPLETED on submission; both may exit to SKIPPED or CANCELLED.
 */
public enum QueueStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED,
    CANCELLED;

    public Set<QueueStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, SKIPPED, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, SKIPPED, CANCELLED);
            case COMPLETED, SKIPPED, CANCELLED -> EnumSet.noneOf(QueueStatus.class);
        };
    }

    public boolean canTransitionTo(QueueStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
