package com.invoice.mapping.service;

import com.invoice.mapping.entity.MappingRule;
import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.exception.InvalidOcrPayloadException;
import com.invoice.mapping.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Top-level orchestrator for one document:
 *   identify forwarder, load rules, map fields, score, route, queue.
 *
 * Auto-approved documents complete immediately; everything else ends up
 * PENDING_REVIEW with a queue entry.
 */
@Service
@Slf4j
public class DocumentProcessingService {

    private final ForwarderIdentificationService identificationService;
    private final RuleCatalogService catalogService;
    private final FieldMapper fieldMapper;
    private final HistoricalAccuracyService historicalAccuracyService;
    private final ConfidenceAggregator confidenceAggregator;
    private final RoutingEngine routingEngine;
    private final ProcessingQueueService queueService;
    private final Clock clock;

    public DocumentProcessingService(
            ForwarderIdentificationService identificationService,
            RuleCatalogService catalogService,
            FieldMapper fieldMapper,
            HistoricalAccuracyService historicalAccuracyService,
            ConfidenceAggregator confidenceAggregator,
            RoutingEngine routingEngine,
            ProcessingQueueService queueService,
            Clock clock) {

        this.identificationService = identificationService;
        this.catalogService = catalogService;
        this.fieldMapper = fieldMapper;
        this.historicalAccuracyService = historicalAccuracyService;
        this.confidenceAggregator = confidenceAggregator;
        this.routingEngine = routingEngine;
        this.queueService = queueService;
        this.clock = clock;
    }

    public ProcessingOutcome process(DocumentProcessingRequest request) {
        OcrPayload payload = request.getPayload();
        if (payload == null || payload.getText() == null) {
            throw new InvalidOcrPayloadException("Document " + request.getDocumentId() + " has no OCR text");
        }

        // 1. Forwarder: given by the caller, or identified from the text
        ForwarderMatch identification = null;
        String forwarderCode = request.getForwarderCode();
        if (forwarderCode == null) {
            identification = identificationService.identify(payload.getText()).orElse(null);
            forwarderCode = identification == null ? null : identification.getForwarderCode();
        }

        // 2. Map fields with the forwarder's rules plus universal ones
        List<MappingRule> rules = catalogService.getActiveRules(forwarderCode);
        MappingResult mapping = fieldMapper.map(payload, rules, forwarderCode);

        // 3. Score
        Map<String, HistoricalAccuracy> history = historicalAccuracyService.forForwarder(forwarderCode);
        DocumentConfidence confidence = confidenceAggregator.aggregate(mapping, history);

        // 4. Route and queue
        RoutingDecision decision = routingEngine.route(confidence, ageOf(request.getDocumentCreatedAt()));
        ProcessingQueueItem queueItem = queueService.enqueue(request.getDocumentId(), decision).orElse(null);

        DocumentStatus status = decision.getPath() == ProcessingPath.AUTO_APPROVE
                ? DocumentStatus.COMPLETED
                : DocumentStatus.PENDING_REVIEW;

        log.info("Document {} routed to {} ({}), status {}",
                request.getDocumentId(), decision.getPath(), decision.getReason(), status);

        return ProcessingOutcome.builder()
                .documentId(request.getDocumentId())
                .forwarderCode(forwarderCode)
                .identification(identification)
                .mapping(mapping)
                .confidence(confidence)
                .decision(decision)
                .queueItem(queueItem)
                .status(status)
                .build();
    }

    /**
     * Processes each document on its own; a failing document is reported
     * without affecting the others.
     */
    public BatchProcessingResult processBatch(List<DocumentProcessingRequest> requests) {
        List<ProcessingOutcome> processed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (DocumentProcessingRequest request : requests) {
            try {
                processed.add(process(request));
            } catch (RuntimeException e) {
                log.warn("Document {} failed: {}", request.getDocumentId(), e.getMessage());
                failures.put(request.getDocumentId(), e.getMessage());
            }
        }

        log.info("Batch done: {} processed, {} failed", processed.size(), failures.size());
        return new BatchProcessingResult(processed, failures);
    }

    private Duration ageOf(Instant createdAt) {
        if (createdAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, clock.instant());
    }
}
