package com.invoice.mapping.entity;

import com.invoice.mapping.model.ProcessingPath;
import com.invoice.mapping.model.QueueStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A document's place in the human review backlog. One row per document,
 * updated in place when the document is re-routed. A re-route computed from
 * a stale copy fails on the version check instead of overwriting a claim.
 */
@Entity
@Table(name = "processing_queue",
       indexes = @Index(name = "idx_queue_status_priority", columnList = "status, priority"))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingQueueItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false, unique = true)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_path", nullable = false)
    private ProcessingPath processingPath;

    @Column(nullable = false)
    private int priority;

    @Column(name = "routing_reason", length = 1000)
    private String routingReason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueStatus status;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "entered_at", nullable = false)
    private Instant enteredAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "fields_reviewed")
    private Integer fieldsReviewed;

    @Column(name = "fields_modified")
    private Integer fieldsModified;

    @Column(name = "review_notes", length = 2000)
    private String reviewNotes;

    // Bumped by every conditional update in ProcessingQueueRepository as well
    @Version
    private Long version;
}
