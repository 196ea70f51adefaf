package com.invoice.mapping.service;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Scores each mapped field and the document as a whole.
 *
 * A field's score blends four 0..100 factors with the configured weights:
 * OCR confidence, rule-match strength of the extraction method, format
 * validation and historical reviewer accuracy for the forwarder+field.
 * The document score is the mean over non-empty fields; empty fields score
 * 0 and are left out of the mean.
 */
@Service
@Slf4j
public class ConfidenceAggregator {

    private final ConfidenceProperties properties;

    public ConfidenceAggregator(ConfidenceProperties properties) {
        this.properties = properties;
    }

    /**
     * @param history historical accuracy by field name; missing fields use the default
     */
    public DocumentConfidence aggregate(MappingResult result, Map<String, HistoricalAccuracy> history) {
        Map<String, HistoricalAccuracy> known = history == null ? Map.of() : history;
        Map<String, FieldConfidence> scores = new LinkedHashMap<>();
        for (FieldMapping mapping : result.getMappings().values()) {
            scores.put(mapping.getFieldName(), scoreField(mapping, known.get(mapping.getFieldName())));
        }
        DocumentConfidence confidence = summarize(scores);
        log.debug("Document confidence {} ({}), {} high / {} medium / {} low",
                confidence.getOverallScore(), confidence.getLevel(),
                confidence.getHighConfidenceFields(), confidence.getMediumConfidenceFields(),
                confidence.getLowConfidenceFields());
        return confidence;
    }

    public FieldConfidence scoreField(FieldMapping mapping, HistoricalAccuracy history) {
        if (mapping.isEmpty()) {
            return FieldConfidence.empty(mapping.getFieldName());
        }

        ConfidenceProperties.Weights weights = properties.getWeights();
        FactorContribution ocr = contribution(ConfidenceFactor.OCR_CONFIDENCE,
                weights.getOcrConfidence(), mapping.getConfidence());
        FactorContribution rule = contribution(ConfidenceFactor.RULE_MATCH,
                weights.getRuleMatch(), ruleMatchStrength(mapping));
        FactorContribution format = contribution(ConfidenceFactor.FORMAT_VALIDATION,
                weights.getFormatValidation(), mapping.isValid() ? 100.0 : properties.getInvalidFormatScore());
        FactorContribution historical = contribution(ConfidenceFactor.HISTORICAL_ACCURACY,
                weights.getHistoricalAccuracy(), historicalScore(history));

        double sum = ocr.getContribution() + rule.getContribution()
                + format.getContribution() + historical.getContribution();
        double total = weights.total();
        // weights are meant to sum to 1; rescale if configured otherwise
        double blended = total > 0 && Math.abs(total - 1.0) > 1e-9 ? sum / total : sum;
        int score = (int) Math.max(0, Math.min(100, Math.round(blended)));

        return FieldConfidence.builder()
                .fieldName(mapping.getFieldName())
                .score(score)
                .level(levelOf(score))
                .contribution(ocr)
                .contribution(rule)
                .contribution(format)
                .contribution(historical)
                .build();
    }

    /**
     * Sample-weighted accuracy: observed accuracy is trusted fully from the
     * configured sample size on, and blended with the default below it.
     */
    public double historicalScore(HistoricalAccuracy history) {
        double fallback = properties.getDefaultHistoricalAccuracy();
        if (history == null || history.getSampleSize() <= 0) {
            return fallback;
        }
        double weight = Math.min(1.0, (double) history.getSampleSize() / properties.getFullTrustSampleSize());
        double accuracy = Math.max(0.0, Math.min(100.0, history.getAccuracy()));
        return accuracy * weight + fallback * (1.0 - weight);
    }

    // ─── HELPERS ────────────────────────────────────────────────────────

    private DocumentConfidence summarize(Map<String, FieldConfidence> scores) {
        int high = 0;
        int medium = 0;
        int low = 0;
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;

        for (FieldConfidence field : scores.values()) {
            switch (field.getLevel()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                default -> low++;
            }
            min = Math.min(min, field.getScore());
            max = Math.max(max, field.getScore());
        }

        double overall = mean(scores.values().stream().filter(f -> !f.isEmpty()).toList(),
                FieldConfidence::getScore);

        return DocumentConfidence.builder()
                .overallScore(overall)
                .level(levelOf(overall))
                .fieldScores(Collections.unmodifiableMap(scores))
                .totalFields(scores.size())
                .highConfidenceFields(high)
                .mediumConfidenceFields(medium)
                .lowConfidenceFields(low)
                .minScore(scores.isEmpty() ? 0 : min)
                .maxScore(scores.isEmpty() ? 0 : max)
                .build();
    }

    private static <T> double mean(Collection<T> items, ToIntFunction<T> score) {
        if (items.isEmpty()) return 0.0;
        long sum = items.stream().mapToLong(score::applyAsInt).sum();
        return BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(items.size()), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Strength of the extraction method, plus a bonus when a rule produced
     * the value rather than a pre-extracted field or fallback.
     */
    double ruleMatchStrength(FieldMapping mapping) {
        ConfidenceProperties.RuleMatch strengths = properties.getRuleMatch();
        double base = switch (mapping.getMethod()) {
            case PRETRAINED -> strengths.getPretrained();
            case REGEX -> strengths.getRegex();
            case KEYWORD -> strengths.getKeyword();
            case POSITION -> strengths.getPosition();
            case DEFAULT, NONE -> strengths.getFallback();
        };
        return base + (mapping.getRuleId() != null ? strengths.getRuleBonus() : 0);
    }

    private ConfidenceLevel levelOf(double score) {
        return ConfidenceLevel.of(score, properties.getHighLevelThreshold(), properties.getMediumLevelThreshold());
    }

    private static FactorContribution contribution(ConfidenceFactor factor, double weight, double rawScore) {
        double clamped = Math.max(0.0, Math.min(100.0, rawScore));
        return new FactorContribution(factor, weight, clamped, clamped * weight);
    }
}
