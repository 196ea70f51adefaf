package com.invoice.mapping.service;

import com.invoice.mapping.config.RoutingProperties;
import com.invoice.mapping.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoutingEngine")
class RoutingEngineTest {

    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");
    private static final String[] CRITICAL = {
            "invoiceNumber", "invoiceDate", "totalAmount", "currency", "shipperName", "consigneeName"};

    private RoutingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RoutingEngine(new RoutingProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Confidence with every critical field at 90 unless overridden; a negative
     * override marks the field empty.
     */
    private static DocumentConfidence confidence(double overall, Map<String, Integer> overrides) {
        Map<String, FieldConfidence> fields = new LinkedHashMap<>();
        for (String name : CRITICAL) {
            int score = overrides.getOrDefault(name, 90);
            fields.put(name, score < 0
                    ? FieldConfidence.empty(name)
                    : FieldConfidence.builder().fieldName(name).score(score).level(ConfidenceLevel.MEDIUM).build());
        }
        overrides.forEach((name, score) -> {
            if (!fields.containsKey(name)) {
                fields.put(name, FieldConfidence.builder().fieldName(name).score(score).level(ConfidenceLevel.LOW).build());
            }
        });
        return DocumentConfidence.builder()
                .overallScore(overall)
                .level(ConfidenceLevel.MEDIUM)
                .fieldScores(fields)
                .totalFields(fields.size())
                .build();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "100.0, AUTO_APPROVE",
            "95.0,  AUTO_APPROVE",
            "94.99, QUICK_REVIEW",
            "80.0,  QUICK_REVIEW",
            "79.99, FULL_REVIEW",
            "0.0,   FULL_REVIEW"
    })
    @DisplayName("Should route by overall score at the threshold boundaries")
    void shouldRouteAtBoundaries(double overall, ProcessingPath expected) {
        assertThat(engine.determinePath(overall, 0)).isEqualTo(expected);
        assertThat(engine.determinePath(overall, 2)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject scores outside 0..100")
    void shouldRejectOutOfRangeScore() {
        assertThatThrownBy(() -> engine.determinePath(100.01, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.determinePath(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.determinePath(Double.NaN, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Critical fields")
    class CriticalFields {

        @Test
        @DisplayName("Should require manual review when three critical fields fail despite a high score")
        void shouldOverrideHighScore() {
            RoutingDecision decision = engine.route(confidence(96.0,
                    Map.of("invoiceNumber", 60, "totalAmount", 60, "currency", 60)), Duration.ZERO);

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.MANUAL_REQUIRED);
            assertThat(decision.getCriticalFieldsAffected())
                    .containsExactly("invoiceNumber", "totalAmount", "currency");
            assertThat(decision.getReason()).startsWith("3 critical fields below 80%");
            assertThat(decision.requiresReview()).isTrue();
        }

        @Test
        @DisplayName("Should count empty critical fields as failing")
        void shouldCountEmptyCriticalFields() {
            RoutingDecision decision = engine.route(confidence(97.0,
                    Map.of("shipperName", -1, "consigneeName", -1, "invoiceDate", 79)), Duration.ZERO);

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.MANUAL_REQUIRED);
            assertThat(decision.getLowConfidenceFields())
                    .containsExactly("invoiceDate", "shipperName", "consigneeName");
        }

        @Test
        @DisplayName("Should not override with two failing critical fields")
        void shouldNotOverrideBelowLimit() {
            RoutingDecision decision = engine.route(confidence(96.0,
                    Map.of("invoiceNumber", 60, "currency", 60)), Duration.ZERO);

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.AUTO_APPROVE);
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Should auto-approve at 96% with no failing critical field")
        void shouldAutoApprove() {
            RoutingDecision decision = engine.route(confidence(96.0, Map.of()), Duration.ofDays(3));

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.AUTO_APPROVE);
            assertThat(decision.requiresReview()).isFalse();
            assertThat(decision.getPriority()).isZero();
            assertThat(decision.getDecidedBy()).isEqualTo("system");
            assertThat(decision.getDecidedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should send 72% with one failing critical field to full review with bonuses")
        void shouldFullReviewWithBonuses() {
            RoutingDecision decision = engine.route(confidence(72.0,
                    Map.of("totalAmount", 50, "poNumber", 40)), Duration.ofHours(50));

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.FULL_REVIEW);
            // base 60 + 2 days * 5 + 1 critical * 5
            assertThat(decision.getPriority()).isEqualTo(75);
            assertThat(decision.getLowConfidenceFields()).containsExactly("totalAmount", "poNumber");
            assertThat(decision.getCriticalFieldsAffected()).containsExactly("totalAmount");
            assertThat(decision.getReason())
                    .isEqualTo("Overall confidence 72.00% is below 80%; 1 critical fields affected");
        }

        @Test
        @DisplayName("Should quick-review scores between the thresholds")
        void shouldQuickReview() {
            RoutingDecision decision = engine.route(confidence(88.5, Map.of("poNumber", 70)), Duration.ZERO);

            assertThat(decision.getPath()).isEqualTo(ProcessingPath.QUICK_REVIEW);
            assertThat(decision.getPriority()).isEqualTo(40);
            assertThat(decision.getLowConfidenceFields()).containsExactly("poNumber");
        }

        @Test
        @DisplayName("Should produce an equal decision for equal inputs")
        void shouldBeDeterministic() {
            DocumentConfidence input = confidence(83.0, Map.of("currency", 10));

            RoutingDecision first = engine.route(input, Duration.ofHours(30));
            RoutingDecision second = engine.route(input, Duration.ofHours(30));

            assertThat(second).isEqualTo(first);
            assertThat(second.getReason()).isEqualTo(first.getReason());
        }
    }

    @Nested
    @DisplayName("Priority")
    class Priority {

        @Test
        @DisplayName("Should cap the age bonus")
        void shouldCapAgeBonus() {
            assertThat(engine.calculatePriority(ProcessingPath.QUICK_REVIEW, Duration.ofDays(30), 0)).isEqualTo(60);
        }

        @Test
        @DisplayName("Should clamp priority to 100")
        void shouldClampPriority() {
            assertThat(engine.calculatePriority(ProcessingPath.MANUAL_REQUIRED, Duration.ofDays(10), 6)).isEqualTo(100);
        }

        @Test
        @DisplayName("Should ignore a negative age")
        void shouldIgnoreNegativeAge() {
            assertThat(engine.calculatePriority(ProcessingPath.FULL_REVIEW, Duration.ofDays(-2), 0)).isEqualTo(60);
            assertThat(engine.calculatePriority(ProcessingPath.FULL_REVIEW, null, 0)).isEqualTo(60);
        }
    }
}
