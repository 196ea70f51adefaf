package com.invoice.mapping.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * @param pattern         the regular expression
 * @param flags           any of {@code i} (case-insensitive), {@code m} (multiline), {@code s} (dotall)
 * @param group           capture group to return; when null, group 1 if the pattern has one, else the whole match
 * @param preprocessor    applied to the captured text
 * @param confidenceBoost added to the regex base confidence, capped at 100
 */
public record RegexPattern(String pattern, String flags, @JsonAlias("groupIndex") Integer group,
                           Preprocessor preprocessor, Integer confidenceBoost)
        implements ExtractionPattern {

    public RegexPattern {
        if (preprocessor == null) preprocessor = Preprocessor.NONE;
        if (flags == null) flags = "";
    }

    public RegexPattern(String pattern, String flags, Integer group, Preprocessor preprocessor) {
        this(pattern, flags, group, preprocessor, null);
    }

    public static RegexPattern of(String pattern) {
        return new RegexPattern(pattern, "", null, Preprocessor.NONE, null);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.REGEX;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRegex(this);
    }
}
