package com.invoice.mapping.entity;

import com.invoice.mapping.model.ExtractionPattern;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One operator-authored extraction instruction for one standardized field.
 * A null forwarder code makes the rule universal. Rules are disabled, never deleted.
 */
@Entity
@Table(name = "mapping_rules",
       indexes = @Index(name = "idx_mapping_rules_forwarder_field", columnList = "forwarder_code, field_name"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "forwarder_code")
    private String forwarderCode;      // null = universal

    @Column(name = "field_name", nullable = false)
    private String fieldName;          // 'invoiceNumber', 'totalAmount'

    @Convert(converter = ExtractionPatternConverter.class)
    @Column(name = "extraction_pattern", nullable = false, length = 4000)
    private ExtractionPattern extractionPattern;

    @Column(nullable = false)
    private int priority;

    @Column(name = "validation_pattern", length = 500)
    private String validationPattern;

    @Column(name = "default_value")
    private String defaultValue;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean isUniversal() {
        return forwarderCode == null;
    }
}
