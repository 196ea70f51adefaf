package com.invoice.mapping.exception;

public class QueueItemNotFoundException extends RuntimeException {

    public QueueItemNotFoundException(Long queueItemId) {
        super("Queue item not found: " + queueItemId);
    }
}
