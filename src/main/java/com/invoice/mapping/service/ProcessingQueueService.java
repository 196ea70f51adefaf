package com.invoice.mapping.service;

import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.exception.IllegalQueueTransitionException;
import com.invoice.mapping.exception.QueueItemNotFoundException;
import com.invoice.mapping.model.*;
import com.invoice.mapping.repository.ProcessingQueueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The human review backlog. Status changes go through conditional updates
 * so that two reviewers can never hold the same document.
 */
@Service
@Slf4j
@Transactional
public class ProcessingQueueService {

    private static final EnumSet<QueueStatus> OPEN = EnumSet.of(QueueStatus.PENDING, QueueStatus.IN_PROGRESS);

    private final ProcessingQueueRepository queueRepo;
    private final QueueItemStateMachine stateMachine;
    private final Clock clock;

    public ProcessingQueueService(ProcessingQueueRepository queueRepo,
                                  QueueItemStateMachine stateMachine,
                                  Clock clock) {
        this.queueRepo = queueRepo;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    // ─── ROUTING ────────────────────────────────────────────────────────

    /**
     * Creates or updates the document's queue entry for a routing decision.
     *
     * @return the stored entry, empty when the document needs no review entry
     * @throws IllegalQueueTransitionException when the document is under review, or was
     *                                         claimed while this decision was being applied
     */
    public Optional<ProcessingQueueItem> enqueue(String documentId, RoutingDecision decision) {
        ProcessingQueueItem current = queueRepo.findByDocumentId(documentId).orElse(null);

        Optional<ProcessingQueueItem> next;
        try {
            next = stateMachine.apply(current, documentId, decision);
        } catch (IllegalQueueTransitionException e) {
            log.warn("Re-route of document {} rejected: {}", documentId, e.getMessage());
            throw e;
        }

        Optional<ProcessingQueueItem> saved;
        try {
            // flushed here so a concurrent claim surfaces as a version conflict in this call
            saved = next.map(queueRepo::saveAndFlush);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Re-route of document {} rejected: queue item changed concurrently", documentId);
            throw IllegalQueueTransitionException.concurrentChange(documentId);
        }
        saved.ifPresent(item -> log.info("Queue item {} for document {}: {} {} priority {}",
                item.getId(), documentId, item.getStatus(), item.getProcessingPath(), item.getPriority()));
        return saved;
    }

    // ─── REVIEW LIFECYCLE ───────────────────────────────────────────────

    /**
     * Claims a pending item for a reviewer.
     *
     * @throws IllegalQueueTransitionException when the item is no longer pending
     */
    public ProcessingQueueItem assign(Long id, String reviewer) {
        if (reviewer == null || reviewer.isBlank()) {
            throw new IllegalArgumentException("Reviewer is required");
        }

        int updated = queueRepo.claimPending(id, reviewer, clock.instant(),
                QueueStatus.PENDING, QueueStatus.IN_PROGRESS);
        if (updated == 0) {
            requireItem(id);
            log.warn("Assignment of queue item {} to {} rejected: not pending", id, reviewer);
            throw IllegalQueueTransitionException.notPending(id);
        }

        log.info("Queue item {} assigned to {}", id, reviewer);
        return requireItem(id);
    }

    public ProcessingQueueItem complete(Long id, ReviewSummary review) {
        int updated = queueRepo.completeInProgress(id,
                review.getFieldsReviewed(), review.getFieldsModified(), review.getNotes(),
                clock.instant(), QueueStatus.IN_PROGRESS, QueueStatus.COMPLETED);
        if (updated == 0) {
            ProcessingQueueItem item = requireItem(id);
            throw IllegalQueueTransitionException.of(id, item.getStatus(), QueueStatus.COMPLETED);
        }

        log.info("Queue item {} completed ({} reviewed, {} modified)",
                id, review.getFieldsReviewed(), review.getFieldsModified());
        return requireItem(id);
    }

    public ProcessingQueueItem skip(Long id, String reason) {
        return close(id, QueueStatus.SKIPPED, reason);
    }

    public ProcessingQueueItem cancel(Long id, String reason) {
        return close(id, QueueStatus.CANCELLED, reason);
    }

    private ProcessingQueueItem close(Long id, QueueStatus target, String reason) {
        int updated = queueRepo.closeFrom(id, OPEN, target, reason, clock.instant());
        if (updated == 0) {
            ProcessingQueueItem item = requireItem(id);
            throw IllegalQueueTransitionException.of(id, item.getStatus(), target);
        }
        log.info("Queue item {} {}{}", id, target, reason == null ? "" : ": " + reason);
        return requireItem(id);
    }

    // ─── QUERIES ────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public ProcessingQueueItem get(Long id) {
        return requireItem(id);
    }

    /**
     * Items in a status, most urgent first, oldest first among equal priority.
     *
     * @param path null for all paths
     */
    @Transactional(readOnly = true)
    public List<ProcessingQueueItem> list(ProcessingPath path, QueueStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return path == null
                ? queueRepo.findByStatusOrderByPriorityDescEnteredAtAsc(status, page)
                : queueRepo.findByProcessingPathAndStatusOrderByPriorityDescEnteredAtAsc(path, status, page);
    }

    @Transactional(readOnly = true)
    public Optional<ProcessingQueueItem> next(ProcessingPath path) {
        return list(path, QueueStatus.PENDING, 1).stream().findFirst();
    }

    /**
     * Number of items a reviewer currently has in progress.
     */
    @Transactional(readOnly = true)
    public long pendingCountFor(String reviewer) {
        return queueRepo.countByAssignedToAndStatus(reviewer, QueueStatus.IN_PROGRESS);
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        Map<ProcessingPath, Map<QueueStatus, Long>> counts = new EnumMap<>(ProcessingPath.class);
        long pending = 0;
        long inProgress = 0;

        for (Object[] row : queueRepo.countByPathAndStatus()) {
            ProcessingPath path = (ProcessingPath) row[0];
            QueueStatus status = (QueueStatus) row[1];
            long count = ((Number) row[2]).longValue();
            counts.computeIfAbsent(path, p -> new EnumMap<>(QueueStatus.class)).put(status, count);
            if (status == QueueStatus.PENDING) pending += count;
            if (status == QueueStatus.IN_PROGRESS) inProgress += count;
        }

        Instant now = clock.instant();
        List<Instant> entered = queueRepo.findEnteredAtByStatus(QueueStatus.PENDING);
        double averageWait = entered.stream()
                .mapToLong(at -> Duration.between(at, now).toMinutes())
                .average()
                .orElse(0.0);

        return QueueStats.builder()
                .counts(counts)
                .totalPending(pending)
                .totalInProgress(inProgress)
                .averageWaitMinutes(Math.round(averageWait * 100.0) / 100.0)
                .build();
    }

    private ProcessingQueueItem requireItem(Long id) {
        return queueRepo.findById(id).orElseThrow(() -> new QueueItemNotFoundException(id));
    }
}
