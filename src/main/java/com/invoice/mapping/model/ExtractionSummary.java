package com.invoice.mapping.model;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Counters over one document's field mappings. Always derived, never edited.
 */
@Value
public class ExtractionSummary {
    int totalFields;
    int mappedFields;
    int unmappedFields;
    int validFields;
    int invalidFields;
    double averageConfidence;

    public static ExtractionSummary of(Collection<FieldMapping> mappings) {
        int mapped = 0;
        int valid = 0;
        int invalid = 0;
        long confidenceSum = 0;

        for (FieldMapping mapping : mappings) {
            if (mapping.isEmpty()) continue;
            mapped++;
            confidenceSum += mapping.getConfidence();
            if (mapping.isValid()) {
                valid++;
            } else {
                invalid++;
            }
        }

        double average = mapped == 0 ? 0.0 : BigDecimal.valueOf(confidenceSum)
                .divide(BigDecimal.valueOf(mapped), 2, RoundingMode.HALF_UP)
                .doubleValue();

        return new ExtractionSummary(mappings.size(), mapped, mappings.size() - mapped,
                valid, invalid, average);
    }
}
