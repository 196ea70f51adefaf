package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.CandidateMatch;
import com.invoice.mapping.model.ExtractionMethod;
import com.invoice.mapping.model.OcrPayload;
import com.invoice.mapping.model.OcrPayload.PretrainedField;
import com.invoice.mapping.model.PretrainedFieldPattern;
import com.invoice.mapping.model.StandardField;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Passes through values the OCR service extracted itself. The service's
 * 0..1 confidence is scaled to 0..100.
 */
@Component
public class PretrainedFieldMatcher implements PatternMatcher<PretrainedFieldPattern> {

    private final ConfidenceProperties properties;

    public PretrainedFieldMatcher(ConfidenceProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CandidateMatch> match(PretrainedFieldPattern rule, OcrPayload payload) {
        if (rule.name() == null || rule.name().isBlank()) {
            throw new InvalidRuleException("Pretrained rule has no field name");
        }
        return lookup(rule.name(), payload);
    }

    /**
     * Looks up the catalog field's pre-extracted counterpart, if it has one.
     */
    public Optional<CandidateMatch> matchStandardField(StandardField field, OcrPayload payload) {
        return field.pretrainedName().flatMap(name -> lookup(name, payload));
    }

    private Optional<CandidateMatch> lookup(String name, OcrPayload payload) {
        Map<String, PretrainedField> fields = payload.getPretrainedFields();
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }

        PretrainedField field = fields.get(name);
        if (field == null) {
            field = fields.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(name))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        if (field == null || field.getValue() == null || field.getValue().isBlank()) {
            return Optional.empty();
        }

        return Optional.of(CandidateMatch.builder()
                .value(field.getValue())
                .sourceText(field.getValue())
                .confidence(scale(field.getConfidence()))
                .method(ExtractionMethod.PRETRAINED)
                .build());
    }

    private int scale(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return properties.getMethod().getPretrained();
        }
        long scaled = Math.round(confidence * 100.0);
        return (int) Math.max(0, Math.min(100, scaled));
    }
}
