package com.invoice.mapping.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Matches a label such as {@code "Shipper:"} and takes what follows it on the
 * same line. Alternative labels ({@code Shipper}, {@code Sender}, {@code From})
 * are tried in order; the first one that yields a value wins.
 *
 * @param keywords        labels, in order of preference
 * @param maxDistance     how many characters after the label may hold the value; null for the rest of the line
 * @param confidenceBoost added to the keyword base confidence, capped at 100
 * @param preprocessor    applied to the value
 */
public record KeywordPattern(List<String> keywords, Integer maxDistance, Integer confidenceBoost,
                             Preprocessor preprocessor) implements ExtractionPattern {

    public KeywordPattern {
        keywords = keywords == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keywords));
        if (preprocessor == null) preprocessor = Preprocessor.NONE;
    }

    public static KeywordPattern of(String... keywords) {
        return new KeywordPattern(Arrays.asList(keywords), null, null, Preprocessor.TRIM);
    }

    // Rules authored with a single "keyword" are read as a one-label list
    @JsonCreator
    static KeywordPattern fromJson(@JsonProperty("keywords") List<String> keywords,
                                   @JsonProperty("keyword") String keyword,
                                   @JsonProperty("maxDistance") Integer maxDistance,
                                   @JsonProperty("confidenceBoost") Integer confidenceBoost,
                                   @JsonProperty("preprocessor") Preprocessor preprocessor) {
        List<String> labels = new ArrayList<>();
        if (keyword != null) labels.add(keyword);
        if (keywords != null) labels.addAll(keywords);
        return new KeywordPattern(labels, maxDistance, confidenceBoost, preprocessor);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.KEYWORD;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitKeyword(this);
    }
}
