package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Backlog counters by path and status, and how long pending items have waited on average.
 */
@Value
@Builder
public class QueueStats {
    Map<ProcessingPath, Map<QueueStatus, Long>> counts;
    long totalPending;
    long totalInProgress;
    double averageWaitMinutes;
}
