package com.invoice.mapping.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Reviewer-confirmed accuracy of one field, per forwarder or universal.
 * Written by the correction-analysis batch; read-only here.
 */
@Entity
@Table(name = "field_accuracy",
       uniqueConstraints = @UniqueConstraint(columnNames = {"forwarder_code", "field_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldAccuracy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "forwarder_code")
    private String forwarderCode;      // null = across all forwarders

    @Column(name = "field_name", nullable = false)
    private String fieldName;

    @Column(nullable = false)
    private double accuracy;

    @Column(name = "sample_size", nullable = false)
    private int sampleSize;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
