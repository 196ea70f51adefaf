package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Value;

/**
 * A value one matcher found for one rule, before normalization and validation.
 */
@Value
@Builder
public class CandidateMatch {
    String value;
    String sourceText;
    Integer page;
    BoundingBox position;
    int confidence;
    ExtractionMethod method;
}
