package com.invoice.mapping.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A freight forwarder whose invoices share a layout. Its identification
 * patterns are matched against OCR text when the caller does not say who
 * issued the document.
 */
@Entity
@Table(name = "forwarders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forwarder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String code;               // 'DHL', 'KN', 'DSV'

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ForwarderStatus status = ForwarderStatus.ACTIVE;

    /** Checked first when two forwarders score the same. */
    @Column(nullable = false)
    private int priority;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "name_patterns", nullable = false, length = 2000)
    @Builder.Default
    private List<String> names = new ArrayList<>();

    @Convert(converter = JsonListConverter.class)
    @Column(name = "keyword_patterns", nullable = false, length = 2000)
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /** Regexes for document number formats, e.g. tracking numbers. */
    @Convert(converter = JsonListConverter.class)
    @Column(name = "format_patterns", nullable = false, length = 2000)
    @Builder.Default
    private List<String> formats = new ArrayList<>();

    public enum ForwarderStatus { ACTIVE, INACTIVE }
}
