package com.invoice.mapping.exception;

import com.invoice.mapping.model.QueueStatus;

/**
 * A queue state change that the item's current status does not allow.
 */
public class IllegalQueueTransitionException extends RuntimeException {

    public IllegalQueueTransitionException(String message) {
        super(message);
    }

    public static IllegalQueueTransitionException notPending(Long queueItemId) {
        return new IllegalQueueTransitionException("Queue item is not pending: " + queueItemId);
    }

    public static IllegalQueueTransitionException of(Long queueItemId, QueueStatus from, QueueStatus to) {
        return new IllegalQueueTransitionException(
                "Queue item " + queueItemId + " cannot move from " + from + " to " + to);
    }

    public static IllegalQueueTransitionException concurrentChange(String documentId) {
        return new IllegalQueueTransitionException(
                "Queue item of document " + documentId + " changed while being re-routed");
    }
}
