package com.invoice.mapping.service.matcher;

import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.CandidateMatch;
import com.invoice.mapping.model.ExtractionPattern;
import com.invoice.mapping.model.OcrPayload;

import java.util.Optional;

/**
 * One extraction strategy. Unmatched input is an empty result, never an error.
 *
 * @throws InvalidRuleException only when the pattern itself is malformed
 */
public interface PatternMatcher<P extends ExtractionPattern> {

    Optional<CandidateMatch> match(P pattern, OcrPayload payload);

    /**
     * Base confidence of a method plus a rule's boost, kept within 0..100.
     */
    static int boosted(int base, Integer boost) {
        long total = (long) base + (boost == null ? 0 : boost);
        return (int) Math.max(0, Math.min(100, total));
    }
}
