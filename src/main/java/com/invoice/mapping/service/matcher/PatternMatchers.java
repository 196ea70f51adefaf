package com.invoice.mapping.service.matcher;

import com.invoice.mapping.model.*;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes a rule's pattern to the matcher for its variant.
 */
@Component
public class PatternMatchers {

    private final RegexPatternMatcher regexMatcher;
    private final KeywordPatternMatcher keywordMatcher;
    private final PositionPatternMatcher positionMatcher;
    private final PretrainedFieldMatcher pretrainedMatcher;

    public PatternMatchers(RegexPatternMatcher regexMatcher,
                           KeywordPatternMatcher keywordMatcher,
                           PositionPatternMatcher positionMatcher,
                           PretrainedFieldMatcher pretrainedMatcher) {
        this.regexMatcher = regexMatcher;
        this.keywordMatcher = keywordMatcher;
        this.positionMatcher = positionMatcher;
        this.pretrainedMatcher = pretrainedMatcher;
    }

    public Optional<CandidateMatch> match(ExtractionPattern pattern, OcrPayload payload) {
        return pattern.accept(new ExtractionPattern.Visitor<>() {
            @Override
            public Optional<CandidateMatch> visitRegex(RegexPattern p) {
                return regexMatcher.match(p, payload);
            }

            @Override
            public Optional<CandidateMatch> visitKeyword(KeywordPattern p) {
                return keywordMatcher.match(p, payload);
            }

            @Override
            public Optional<CandidateMatch> visitPosition(PositionPattern p) {
                return positionMatcher.match(p, payload);
            }

            @Override
            public Optional<CandidateMatch> visitPretrained(PretrainedFieldPattern p) {
                return pretrainedMatcher.match(p, payload);
            }
        });
    }

    public Optional<CandidateMatch> matchPretrained(StandardField field, OcrPayload payload) {
        return pretrainedMatcher.matchStandardField(field, payload);
    }
}
