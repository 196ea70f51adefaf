package com.invoice.mapping.service;

import com.invoice.mapping.entity.MappingRule;
import com.invoice.mapping.entity.ProcessingQueueItem;
import com.invoice.mapping.exception.InvalidOcrPayloadException;
import com.invoice.mapping.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentProcessingService")
class DocumentProcessingServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T12:00:00Z");

    @Mock private ForwarderIdentificationService identificationService;
    @Mock private RuleCatalogService catalogService;
    @Mock private FieldMapper fieldMapper;
    @Mock private HistoricalAccuracyService historicalAccuracyService;
    @Mock private ConfidenceAggregator confidenceAggregator;
    @Mock private RoutingEngine routingEngine;
    @Mock private ProcessingQueueService queueService;

    private DocumentProcessingService service;

    private final MappingResult mapping = MappingResult.builder().mappings(Map.of()).build();
    private final DocumentConfidence confidence = DocumentConfidence.builder()
            .overallScore(70.0).level(ConfidenceLevel.LOW).build();
    private final List<MappingRule> rules = List.of(MappingRule.builder().id(1L).fieldName("invoiceNumber").build());

    @BeforeEach
    void setUp() {
        service = new DocumentProcessingService(identificationService, catalogService, fieldMapper,
                historicalAccuracyService, confidenceAggregator, routingEngine, queueService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RoutingDecision decision(ProcessingPath path) {
        return RoutingDecision.builder()
                .path(path)
                .reason("r")
                .priority(path == ProcessingPath.AUTO_APPROVE ? 0 : 60)
                .decidedAt(NOW)
                .build();
    }

    private static DocumentProcessingRequest request(String documentId, String forwarderCode, String text) {
        return DocumentProcessingRequest.builder()
                .documentId(documentId)
                .forwarderCode(forwarderCode)
                .payload(text == null ? null : OcrPayload.fromText(text))
                .documentCreatedAt(NOW.minus(Duration.ofDays(2)))
                .build();
    }

    @Test
    @DisplayName("Should identify the forwarder, route and queue a document needing review")
    void shouldProcessDocumentNeedingReview() {
        ForwarderMatch dhl = ForwarderMatch.builder().forwarderCode("DHL").score(80).identified(true).build();
        ProcessingQueueItem queued = ProcessingQueueItem.builder().id(7L).documentId("doc-1")
                .status(QueueStatus.PENDING).build();
        when(identificationService.identify("DHL Express")).thenReturn(Optional.of(dhl));
        when(catalogService.getActiveRules("DHL")).thenReturn(rules);
        when(fieldMapper.map(any(OcrPayload.class), eq(rules), eq("DHL"))).thenReturn(mapping);
        when(historicalAccuracyService.forForwarder("DHL")).thenReturn(Map.of());
        when(confidenceAggregator.aggregate(mapping, Map.of())).thenReturn(confidence);
        when(routingEngine.route(confidence, Duration.ofDays(2))).thenReturn(decision(ProcessingPath.FULL_REVIEW));
        when(queueService.enqueue(eq("doc-1"), any())).thenReturn(Optional.of(queued));

        ProcessingOutcome outcome = service.process(request("doc-1", null, "DHL Express"));

        assertThat(outcome.getForwarderCode()).isEqualTo("DHL");
        assertThat(outcome.getIdentification()).isEqualTo(dhl);
        assertThat(outcome.getStatus()).isEqualTo(DocumentStatus.PENDING_REVIEW);
        assertThat(outcome.getQueueItem()).isEqualTo(queued);
    }

    @Test
    @DisplayName("Should complete an auto-approved document without a queue entry")
    void shouldCompleteAutoApprovedDocument() {
        when(catalogService.getActiveRules("KN")).thenReturn(rules);
        when(fieldMapper.map(any(OcrPayload.class), eq(rules), eq("KN"))).thenReturn(mapping);
        when(historicalAccuracyService.forForwarder("KN")).thenReturn(Map.of());
        when(confidenceAggregator.aggregate(mapping, Map.of())).thenReturn(confidence);
        when(routingEngine.route(eq(confidence), any())).thenReturn(decision(ProcessingPath.AUTO_APPROVE));
        when(queueService.enqueue(eq("doc-2"), any())).thenReturn(Optional.empty());

        ProcessingOutcome outcome = service.process(request("doc-2", "KN", "text"));

        assertThat(outcome.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(outcome.getQueueItem()).isNull();
        assertThat(outcome.getIdentification()).isNull();
        verifyNoInteractions(identificationService);
    }

    @Test
    @DisplayName("Should fall back to universal rules when no forwarder is identified")
    void shouldUseUniversalRulesWhenUnidentified() {
        when(identificationService.identify(anyString())).thenReturn(Optional.empty());
        when(catalogService.getActiveRules(null)).thenReturn(List.of());
        when(fieldMapper.map(any(OcrPayload.class), eq(List.of()), isNull())).thenReturn(mapping);
        when(historicalAccuracyService.forForwarder(null)).thenReturn(Map.of());
        when(confidenceAggregator.aggregate(mapping, Map.of())).thenReturn(confidence);
        when(routingEngine.route(eq(confidence), any())).thenReturn(decision(ProcessingPath.FULL_REVIEW));
        when(queueService.enqueue(eq("doc-3"), any())).thenReturn(Optional.empty());

        ProcessingOutcome outcome = service.process(request("doc-3", null, "unknown layout"));

        assertThat(outcome.getForwarderCode()).isNull();
    }

    @Test
    @DisplayName("Should fail a document without OCR text")
    void shouldRejectMissingPayload() {
        assertThatThrownBy(() -> service.process(request("doc-4", "DHL", null)))
                .isInstanceOf(InvalidOcrPayloadException.class);
        verifyNoInteractions(fieldMapper, queueService);
    }

    @Test
    @DisplayName("Should report failed documents without stopping the batch")
    void shouldIsolateBatchFailures() {
        when(catalogService.getActiveRules("DHL")).thenReturn(rules);
        when(fieldMapper.map(any(OcrPayload.class), eq(rules), eq("DHL"))).thenReturn(mapping);
        when(historicalAccuracyService.forForwarder("DHL")).thenReturn(Map.of());
        when(confidenceAggregator.aggregate(mapping, Map.of())).thenReturn(confidence);
        when(routingEngine.route(eq(confidence), any())).thenReturn(decision(ProcessingPath.AUTO_APPROVE));
        when(queueService.enqueue(anyString(), any())).thenReturn(Optional.empty());

        BatchProcessingResult result = service.processBatch(List.of(
                request("doc-1", "DHL", "a"),
                request("doc-2", "DHL", null),
                request("doc-3", "DHL", "c")));

        assertThat(result.getProcessed()).extracting(ProcessingOutcome::getDocumentId)
                .containsExactly("doc-1", "doc-3");
        assertThat(result.getFailures()).containsOnlyKeys("doc-2");
        assertThat(result.total()).isEqualTo(3);
    }
}
