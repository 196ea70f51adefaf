package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything one mapping run produced for a document: one mapping per
 * catalog field in catalog order, the derived summary, and the rules that
 * were skipped because they could not be applied.
 */
@Value
@Builder
public class MappingResult {
    String forwarderCode;
    Map<String, FieldMapping> mappings;
    ExtractionSummary summary;
    int rulesApplied;
    @Singular
    List<Long> skippedRuleIds;
    @Singular
    List<String> warnings;

    public FieldMapping get(StandardField field) {
        return mappings.get(field.fieldName());
    }

    public FieldMapping get(String fieldName) {
        return mappings.get(fieldName);
    }
}
