package com.invoice.mapping.service;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.entity.MappingRule;
import com.invoice.mapping.exception.InvalidOcrPayloadException;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.*;
import com.invoice.mapping.service.matcher.PatternMatchers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Maps an OCR payload onto the standard field catalog using the pre-extracted
 * fields of the OCR service and the rule catalog.
 *
 * Per field, in order:
 *   1. the OCR service's own value for the field, if it has one
 *   2. rules by priority (highest first, rule id breaks ties), first hit wins
 *   3. the default value of the highest-priority rule that carries one
 *   4. an empty mapping
 *
 * Every catalog field gets exactly one mapping. A rule that cannot be applied
 * is skipped for this run; it never fails the document.
 */
@Service
@Slf4j
public class FieldMapper {

    static final Comparator<MappingRule> RULE_ORDER = Comparator
            .comparingInt(MappingRule::getPriority).reversed()
            .thenComparing(MappingRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final PatternMatchers matchers;
    private final ValueNormalizer normalizer;
    private final ConfidenceProperties properties;

    public FieldMapper(PatternMatchers matchers,
                       ValueNormalizer normalizer,
                       ConfidenceProperties properties) {
        this.matchers = matchers;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    /**
     * @param rules         the forwarder's rules plus universal rules; inactive
     *                      rules and rules of other forwarders are ignored
     * @param forwarderCode the identified forwarder, or null for universal rules only
     * @throws InvalidOcrPayloadException when the payload or its text is missing
     */
    public MappingResult map(OcrPayload payload, List<MappingRule> rules, String forwarderCode) {
        if (payload == null) {
            throw new InvalidOcrPayloadException("OCR payload is missing");
        }
        if (payload.getText() == null) {
            throw new InvalidOcrPayloadException("OCR payload has no text");
        }

        MappingResult.MappingResultBuilder result = MappingResult.builder()
                .forwarderCode(forwarderCode);

        Map<String, List<MappingRule>> rulesByField = groupApplicableRules(rules, forwarderCode, result);

        Map<String, FieldMapping> mappings = new LinkedHashMap<>();
        int rulesApplied = 0;

        for (StandardField field : StandardField.values()) {
            List<MappingRule> fieldRules = rulesByField.getOrDefault(field.fieldName(), List.of());
            FieldMapping mapping = mapField(field, fieldRules, payload, result);
            if (mapping.getRuleId() != null) {
                rulesApplied++;
            }
            mappings.put(field.fieldName(), mapping);
        }

        ExtractionSummary summary = ExtractionSummary.of(mappings.values());
        log.info("Mapped {}/{} fields for forwarder {} (avg confidence {})",
                summary.getMappedFields(), summary.getTotalFields(),
                forwarderCode == null ? "<universal>" : forwarderCode,
                summary.getAverageConfidence());

        return result
                .mappings(Collections.unmodifiableMap(mappings))
                .summary(summary)
                .rulesApplied(rulesApplied)
                .build();
    }

    // ─── PER FIELD ──────────────────────────────────────────────────────

    private FieldMapping mapField(StandardField field, List<MappingRule> fieldRules,
                                  OcrPayload payload, MappingResult.MappingResultBuilder result) {

        Optional<CandidateMatch> pretrained = matchers.matchPretrained(field, payload);
        if (pretrained.isPresent()) {
            log.debug("{} taken from pre-extracted fields", field.fieldName());
            return toMapping(field, pretrained.get(), null, validationPatternOf(fieldRules));
        }

        for (MappingRule rule : fieldRules) {
            try {
                Optional<CandidateMatch> candidate = matchers.match(rule.getExtractionPattern(), payload);
                if (candidate.isPresent()) {
                    log.debug("{} matched by rule {} (priority {})",
                            field.fieldName(), rule.getId(), rule.getPriority());
                    return toMapping(field, candidate.get(), rule.getId(), rule.getValidationPattern());
                }
            } catch (InvalidRuleException e) {
                log.warn("Rule {} for {} skipped: {}", rule.getId(), field.fieldName(), e.getMessage());
                if (rule.getId() != null) {
                    result.skippedRuleId(rule.getId());
                }
                result.warning("Rule " + rule.getId() + " for " + field.fieldName() + " skipped: " + e.getMessage());
            }
        }

        for (MappingRule rule : fieldRules) {
            String defaultValue = rule.getDefaultValue();
            if (defaultValue != null && !defaultValue.isBlank()) {
                CandidateMatch candidate = CandidateMatch.builder()
                        .value(defaultValue)
                        .confidence(properties.getMethod().getDefaultValue())
                        .method(ExtractionMethod.DEFAULT)
                        .build();
                return toMapping(field, candidate, rule.getId(), rule.getValidationPattern());
            }
        }

        return FieldMapping.empty(field.fieldName(), FieldMapping.NO_MATCHING_RULE);
    }

    private FieldMapping toMapping(StandardField field, CandidateMatch candidate,
                                   Long ruleId, String validationPattern) {
        String normalized = normalizer.normalize(field.dataType(), candidate.getValue());
        ValueNormalizer.Validation validation = normalizer.validate(normalized, validationPattern);

        if (!validation.valid()) {
            log.debug("{} value '{}' failed validation", field.fieldName(), normalized);
        }

        return FieldMapping.builder()
                .fieldName(field.fieldName())
                .rawValue(candidate.getValue())
                .value(normalized)
                .sourcePage(candidate.getPage())
                .sourceText(candidate.getSourceText())
                .position(candidate.getPosition())
                .confidence(candidate.getConfidence())
                .method(candidate.getMethod())
                .ruleId(ruleId)
                .valid(validation.valid())
                .validationError(validation.message())
                .empty(false)
                .build();
    }

    // ─── RULE SELECTION ─────────────────────────────────────────────────

    private Map<String, List<MappingRule>> groupApplicableRules(List<MappingRule> rules, String forwarderCode,
                                                               MappingResult.MappingResultBuilder result) {
        if (rules == null || rules.isEmpty()) {
            log.warn("No active rules for forwarder {}", forwarderCode);
            return Map.of();
        }

        Map<String, List<MappingRule>> grouped = rules.stream()
                .filter(MappingRule::isActive)
                .filter(rule -> rule.isUniversal() || rule.getForwarderCode().equals(forwarderCode))
                .filter(rule -> {
                    if (rule.getExtractionPattern() == null) {
                        log.warn("Rule {} has no extraction pattern, skipped", rule.getId());
                        result.warning("Rule " + rule.getId() + " has no extraction pattern");
                        return false;
                    }
                    if (StandardField.byName(rule.getFieldName()).isEmpty()) {
                        log.warn("Rule {} targets unknown field '{}', ignored", rule.getId(), rule.getFieldName());
                        result.warning("Rule " + rule.getId() + " targets unknown field " + rule.getFieldName());
                        return false;
                    }
                    return true;
                })
                .collect(Collectors.groupingBy(MappingRule::getFieldName));

        grouped.values().forEach(list -> list.sort(RULE_ORDER));
        return grouped;
    }

    private static String validationPatternOf(List<MappingRule> fieldRules) {
        return fieldRules.stream()
                .map(MappingRule::getValidationPattern)
                .filter(p -> p != null && !p.isBlank())
                .findFirst()
                .orElse(null);
    }
}
