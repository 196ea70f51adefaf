package com.invoice.mapping.repository;

import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.model.ProcessingPath;
import com.invoice.mapping.model.QueueStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProcessingQueueRepository extends JpaRepository<ProcessingQueueItem, Long> {

    Optional<ProcessingQueueItem> findByDocumentId(String documentId);

    List<ProcessingQueueItem> findByStatusOrderByPriorityDescEnteredAtAsc(QueueStatus status, Pageable pageable);

    List<ProcessingQueueItem> findByProcessingPathAndStatusOrderByPriorityDescEnteredAtAsc(
            ProcessingPath path, QueueStatus status, Pageable pageable);

    long countByAssignedToAndStatus(String assignedTo, QueueStatus status);

    /**
     * Claims a pending item for a reviewer. Returns 0 when the item is no
     * longer pending, so exactly one of two concurrent claims succeeds.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProcessingQueueItem q
        SET q.status = :inProgress, q.assignedTo = :reviewer, q.assignedAt = :now, q.startedAt = :now,
            q.version = q.version + 1
        WHERE q.id = :id AND q.status = :pending
    """)
    int claimPending(@Param("id") Long id,
                     @Param("reviewer") String reviewer,
                     @Param("now") Instant now,
                     @Param("pending") QueueStatus pending,
                     @Param("inProgress") QueueStatus inProgress);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProcessingQueueItem q
        SET q.status = :completed, q.completedAt = :now,
            q.fieldsReviewed = :fieldsReviewed, q.fieldsModified = :fieldsModified, q.reviewNotes = :notes,
            q.version = q.version + 1
        WHERE q.id = :id AND q.status = :inProgress
    """)
    int completeInProgress(@Param("id") Long id,
                           @Param("fieldsReviewed") int fieldsReviewed,
                           @Param("fieldsModified") int fieldsModified,
                           @Param("notes") String notes,
                           @Param("now") Instant now,
                           @Param("inProgress") QueueStatus inProgress,
                           @Param("completed") QueueStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProcessingQueueItem q
        SET q.status = :target, q.completedAt = :now, q.reviewNotes = :reason,
            q.version = q.version + 1
        WHERE q.id = :id AND q.status IN :from
    """)
    int closeFrom(@Param("id") Long id,
                  @Param("from") Collection<QueueStatus> from,
                  @Param("target") QueueStatus target,
                  @Param("reason") String reason,
                  @Param("now") Instant now);

    @Query("""
        SELECT q.processingPath, q.status, COUNT(q)
        FROM ProcessingQueueItem q
        GROUP BY q.processingPath, q.status
    """)
    List<Object[]> countByPathAndStatus();

    @Query("SELECT q.enteredAt FROM ProcessingQueueItem q WHERE q.status = :status")
    List<Instant> findEnteredAtByStatus(@Param("status") QueueStatus status);
}
