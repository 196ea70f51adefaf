package com.invoice.mapping.service;

import com.invoice.mapping.config.RoutingProperties;
import com.invoice.mapping.model.DocumentConfidence;
import com.invoice.mapping.model.FieldConfidence;
import com.invoice.mapping.model.ProcessingPath;
import com.invoice.mapping.model.RoutingDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides how a document proceeds after mapping: approved automatically,
 * or queued for quick, full or manual review.
 *
 * The path depends only on the overall score and the number of failing
 * critical fields. A critical field fails when it is empty or scores below
 * the quick-review threshold; enough failures force MANUAL_REQUIRED whatever
 * the overall score.
 */
@Service
@Slf4j
public class RoutingEngine {

    private final RoutingProperties properties;
    private final Clock clock;

    public RoutingEngine(RoutingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param documentAge time since the document was received; negative is treated as zero
     */
    public RoutingDecision route(DocumentConfidence confidence, Duration documentAge) {
        double overall = confidence.getOverallScore();
        List<String> lowFields = lowConfidenceFields(confidence);
        List<String> criticalAffected = failingCriticalFields(confidence);

        ProcessingPath path = determinePath(overall, criticalAffected.size());
        int priority = path == ProcessingPath.AUTO_APPROVE
                ? 0
                : calculatePriority(path, documentAge, criticalAffected.size());

        RoutingDecision decision = RoutingDecision.builder()
                .path(path)
                .reason(reasonFor(path, overall, lowFields, criticalAffected))
                .confidence(overall)
                .lowConfidenceFields(List.copyOf(lowFields))
                .criticalFieldsAffected(List.copyOf(criticalAffected))
                .priority(priority)
                .decidedAt(clock.instant())
                .build();

        log.debug("Routed to {} (confidence {}, {} critical failing, priority {})",
                path, overall, criticalAffected.size(), priority);
        return decision;
    }

    /**
     * The critical-field check runs before the score thresholds.
     *
     * @throws IllegalArgumentException if the score is outside 0..100 or the failure count is negative
     */
    public ProcessingPath determinePath(double overallScore, int criticalFailures) {
        if (Double.isNaN(overallScore) || overallScore < 0.0 || overallScore > 100.0) {
            throw new IllegalArgumentException("Overall confidence out of range: " + overallScore);
        }
        if (criticalFailures < 0) {
            throw new IllegalArgumentException("Negative critical failure count: " + criticalFailures);
        }

        if (criticalFailures >= properties.getCriticalFailureLimit()) {
            return ProcessingPath.MANUAL_REQUIRED;
        }
        if (overallScore >= properties.getAutoApproveThreshold()) {
            return ProcessingPath.AUTO_APPROVE;
        }
        if (overallScore >= properties.getQuickReviewThreshold()) {
            return ProcessingPath.QUICK_REVIEW;
        }
        return ProcessingPath.FULL_REVIEW;
    }

    /**
     * Base priority of the path, plus a bonus per full day waited (capped),
     * plus a bonus per failing critical field, clamped to 0..100.
     */
    public int calculatePriority(ProcessingPath path, Duration documentAge, int criticalFailures) {
        long days = documentAge == null || documentAge.isNegative() ? 0 : documentAge.toDays();
        long ageBonus = Math.min(days * properties.getAgeBonusPerDay(), properties.getMaxAgeBonus());
        long priority = properties.basePriorityFor(path)
                + ageBonus
                + (long) Math.max(0, criticalFailures) * properties.getCriticalFieldBonus();
        return (int) Math.max(0, Math.min(100, priority));
    }

    // ─── FIELD CHECKS ───────────────────────────────────────────────────

    private List<String> lowConfidenceFields(DocumentConfidence confidence) {
        double threshold = properties.getQuickReviewThreshold();
        List<String> low = new ArrayList<>();
        for (FieldConfidence field : confidence.getFieldScores().values()) {
            if (field.isEmpty()) {
                if (properties.getCriticalFields().contains(field.getFieldName())) {
                    low.add(field.getFieldName());
                }
            } else if (field.getScore() < threshold) {
                low.add(field.getFieldName());
            }
        }
        return low;
    }

    private List<String> failingCriticalFields(DocumentConfidence confidence) {
        double threshold = properties.getQuickReviewThreshold();
        List<String> failing = new ArrayList<>();
        for (String name : properties.getCriticalFields()) {
            if (confidence.isEmpty(name) || confidence.scoreOf(name) < threshold) {
                failing.add(name);
            }
        }
        return failing;
    }

    private String reasonFor(ProcessingPath path, double overall,
                             List<String> lowFields, List<String> criticalAffected) {
        return switch (path) {
            case MANUAL_REQUIRED -> String.format(Locale.ROOT,
                    "%d critical fields below %.0f%% (%s); overall confidence %.2f%%",
                    criticalAffected.size(), properties.getQuickReviewThreshold(),
                    String.join(", ", criticalAffected), overall);
            case AUTO_APPROVE -> String.format(Locale.ROOT,
                    "Overall confidence %.2f%% meets auto-approve threshold %.0f%%",
                    overall, properties.getAutoApproveThreshold());
            case QUICK_REVIEW -> String.format(Locale.ROOT,
                    "Overall confidence %.2f%% is between %.0f%% and %.0f%%; %d fields need review",
                    overall, properties.getQuickReviewThreshold(),
                    properties.getAutoApproveThreshold(), lowFields.size());
            case FULL_REVIEW -> String.format(Locale.ROOT,
                    "Overall confidence %.2f%% is below %.0f%%; %d critical fields affected",
                    overall, properties.getQuickReviewThreshold(), criticalAffected.size());
        };
    }
}
