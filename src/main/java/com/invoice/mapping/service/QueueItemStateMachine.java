package com.invoice.mapping.service;

import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.exception.IllegalQueueTransitionException;
import com.invoice.mapping.model.ProcessingPath;
import com.invoice.mapping.model.QueueStatus;
import com.invoice.mapping.model.RoutingDecision;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Applies a routing decision to a document's queue entry. Pure: the caller
 * loads the current entry and persists whatever comes back.
 *
 * <ul>
 *   <li>no entry, AUTO_APPROVE: nothing to store</li>
 *   <li>no entry, review path: new PENDING entry</li>
 *   <li>PENDING: path, priority and reason updated in place, or cancelled on AUTO_APPROVE</li>
 *   <li>IN_PROGRESS: rejected, an in-flight review is never re-routed</li>
 *   <li>terminal: reopened as PENDING for a review path, left alone on AUTO_APPROVE</li>
 * </ul>
 */
@Component
public class QueueItemStateMachine {

    static final String AUTO_APPROVED_NOTE = "Cancelled: re-routed to auto-approve";

    /**
     * @param current the document's existing entry, or null
     * @return the entry to persist, or empty when nothing changes
     * @throws IllegalQueueTransitionException when the current entry is IN_PROGRESS
     */
    public Optional<ProcessingQueueItem> apply(ProcessingQueueItem current, String documentId,
                                               RoutingDecision decision) {
        boolean autoApprove = decision.getPath() == ProcessingPath.AUTO_APPROVE;

        if (current == null) {
            if (autoApprove) return Optional.empty();
            return Optional.of(ProcessingQueueItem.builder()
                    .documentId(documentId)
                    .processingPath(decision.getPath())
                    .priority(decision.getPriority())
                    .routingReason(decision.getReason())
                    .status(QueueStatus.PENDING)
                    .enteredAt(decision.getDecidedAt())
                    .build());
        }

        QueueStatus status = current.getStatus();
        if (status == QueueStatus.IN_PROGRESS) {
            throw new IllegalQueueTransitionException(
                    "Queue item " + current.getId() + " is under review and cannot be re-routed");
        }

        if (status == QueueStatus.PENDING) {
            if (autoApprove) {
                return Optional.of(current.toBuilder()
                        .status(QueueStatus.CANCELLED)
                        .completedAt(decision.getDecidedAt())
                        .routingReason(decision.getReason())
                        .reviewNotes(AUTO_APPROVED_NOTE)
                        .build());
            }
            return Optional.of(current.toBuilder()
                    .processingPath(decision.getPath())
                    .priority(decision.getPriority())
                    .routingReason(decision.getReason())
                    .build());
        }

        // COMPLETED, SKIPPED, CANCELLED
        if (autoApprove) return Optional.empty();
        return Optional.of(current.toBuilder()
                .processingPath(decision.getPath())
                .priority(decision.getPriority())
                .routingReason(decision.getReason())
                .status(QueueStatus.PENDING)
                .assignedTo(null)
                .assignedAt(null)
                .startedAt(null)
                .completedAt(null)
                .fieldsReviewed(null)
                .fieldsModified(null)
                .reviewNotes(null)
                .enteredAt(decision.getDecidedAt())
                .build());
    }
}
