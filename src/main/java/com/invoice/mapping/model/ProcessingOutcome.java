package com.invoice.mapping.model;

import com.invoice.mapping.entity.ProcessingQueueItem;
import lombok.Builder;
import lombok.Value;

/**
 * The result of running one document through mapping, scoring and routing.
 * {@code queueItem} is null for auto-approved documents.
 */
@Value
@Builder
public class ProcessingOutcome {
    String documentId;
    String forwarderCode;
    ForwarderMatch identification;
    MappingResult mapping;
    DocumentConfidence confidence;
    RoutingDecision decision;
    ProcessingQueueItem queueItem;
    DocumentStatus status;
}
