package com.invoice.mapping.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Confidence blend weights and the fixed per-method confidences.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "invoice.confidence")
public class ConfidenceProperties {

    @Valid
    private Weights weights = new Weights();

    @Valid
    private MethodConfidence method = new MethodConfidence();

    @Valid
    private RuleMatch ruleMatch = new RuleMatch();

    /**
     * Historical accuracy used when no history exists for a forwarder+field.
     */
    @Min(0) @Max(100)
    private double defaultHistoricalAccuracy = 75.0;

    /**
     * Sample count at which historical accuracy is trusted outright; below it
     * the observed accuracy is blended with the default.
     */
    @Min(1)
    private int fullTrustSampleSize = 100;

    /** Format-validation factor for a value that failed its validation pattern. */
    @Min(0) @Max(100)
    private double invalidFormatScore = 40.0;

    /** Score at or above which a field is HIGH. */
    @Min(0) @Max(100)
    private double highLevelThreshold = 95.0;

    /** Score at or above which a field is MEDIUM. */
    @Min(0) @Max(100)
    private double mediumLevelThreshold = 80.0;

    @Data
    public static class Weights {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double ocrConfidence = 0.30;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double ruleMatch = 0.30;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double formatValidation = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double historicalAccuracy = 0.15;

        public double total() {
            return ocrConfidence + ruleMatch + formatValidation + historicalAccuracy;
        }
    }

    @Data
    public static class MethodConfidence {
        @Min(0) @Max(100)
        private int regex = 85;
        @Min(0) @Max(100)
        private int keyword = 70;
        @Min(0) @Max(100)
        private int position = 75;
        /** Used for pre-extracted fields the service reports without a confidence. */
        @Min(0) @Max(100)
        private int pretrained = 90;
        @Min(0) @Max(100)
        private int defaultValue = 50;
    }

    /**
     * Rule-match factor of the blend, by extraction method.
     */
    @Data
    public static class RuleMatch {
        @Min(0) @Max(100)
        private int pretrained = 95;
        @Min(0) @Max(100)
        private int regex = 85;
        @Min(0) @Max(100)
        private int keyword = 70;
        @Min(0) @Max(100)
        private int position = 65;
        /** Default values and empty fields. */
        @Min(0) @Max(100)
        private int fallback = 50;
        /** Added when the value came from a mapping rule. */
        @Min(0) @Max(100)
        private int ruleBonus = 5;
    }
}
