package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KeywordPatternMatcher")
class KeywordPatternMatcherTest {

    private final KeywordPatternMatcher matcher = new KeywordPatternMatcher(new ConfidenceProperties());

    @Test
    @DisplayName("Should return the rest of the line after the label")
    void shouldReturnRemainderOfLine() {
        OcrPayload payload = OcrPayload.fromText("SHIPPER: Acme Trading Ltd\nConsignee: Foo GmbH");

        CandidateMatch match = matcher.match(KeywordPattern.of("shipper"), payload).orElseThrow();

        assertThat(match.getValue()).isEqualTo("Acme Trading Ltd");
        assertThat(match.getSourceText()).isEqualTo("SHIPPER: Acme Trading Ltd");
        assertThat(match.getMethod()).isEqualTo(ExtractionMethod.KEYWORD);
        assertThat(match.getConfidence()).isEqualTo(70);
        assertThat(match.getPage()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should strip leading separators")
    void shouldStripSeparators() {
        OcrPayload payload = OcrPayload.fromText("Currency ;= USD");

        assertThat(matcher.match(KeywordPattern.of("currency"), payload))
                .map(CandidateMatch::getValue)
                .contains("USD");
    }

    @Test
    @DisplayName("Should skip occurrences with nothing after them")
    void shouldTryLaterOccurrences() {
        OcrPayload payload = OcrPayload.fromText("Consignee:\nAddress line\nConsignee: Foo GmbH");

        assertThat(matcher.match(KeywordPattern.of("Consignee"), payload))
                .map(CandidateMatch::getValue)
                .contains("Foo GmbH");
    }

    @Test
    @DisplayName("Should treat regex characters in the label literally")
    void shouldQuoteKeyword() {
        OcrPayload payload = OcrPayload.fromText("Ref (internal): 42");

        assertThat(matcher.match(KeywordPattern.of("Ref (internal)"), payload))
                .map(CandidateMatch::getValue)
                .contains("42");
    }

    @Test
    @DisplayName("Should apply the preprocessor")
    void shouldApplyPreprocessor() {
        OcrPayload payload = OcrPayload.fromText("Incoterm: fob");

        assertThat(matcher.match(new KeywordPattern(List.of("incoterm"), null, null, Preprocessor.UPPERCASE), payload))
                .map(CandidateMatch::getValue)
                .contains("FOB");
    }

    @Test
    @DisplayName("Should return empty when the label is absent")
    void shouldReturnEmptyWhenAbsent() {
        assertThat(matcher.match(KeywordPattern.of("Vessel"), OcrPayload.fromText("Flight: LH400"))).isEmpty();
    }

    @Test
    @DisplayName("Should try alternative labels in rule order")
    void shouldPreferEarlierLabel() {
        OcrPayload payload = OcrPayload.fromText("From: Branch Office\nSender: Acme Trading Ltd");

        assertThat(matcher.match(KeywordPattern.of("Shipper", "Sender", "From"), payload))
                .map(CandidateMatch::getValue)
                .contains("Acme Trading Ltd");
        assertThat(matcher.match(KeywordPattern.of("Shipper", "Consignor"), payload)).isEmpty();
    }

    @Test
    @DisplayName("Should only read the value within the configured distance of the label")
    void shouldLimitToMaxDistance() {
        OcrPayload payload = OcrPayload.fromText("Date: 2024-12-18     Page 1 of 2");
        KeywordPattern rule = new KeywordPattern(List.of("Date"), 12, null, Preprocessor.TRIM);

        assertThat(matcher.match(rule, payload))
                .map(CandidateMatch::getValue)
                .contains("2024-12-18");
    }

    @Test
    @DisplayName("Should add the rule's confidence boost, capped at 100")
    void shouldApplyConfidenceBoost() {
        OcrPayload payload = OcrPayload.fromText("Shipper: Acme Trading Ltd");

        assertThat(matcher.match(new KeywordPattern(List.of("Shipper"), null, 10, Preprocessor.TRIM), payload))
                .map(CandidateMatch::getConfidence)
                .contains(80);
        assertThat(matcher.match(new KeywordPattern(List.of("Shipper"), null, 50, Preprocessor.TRIM), payload))
                .map(CandidateMatch::getConfidence)
                .contains(100);
    }

    @Test
    @DisplayName("Should reject a non-positive distance")
    void shouldRejectNonPositiveDistance() {
        KeywordPattern rule = new KeywordPattern(List.of("Shipper"), 0, null, null);

        assertThatThrownBy(() -> matcher.match(rule, OcrPayload.fromText("Shipper: Acme")))
                .isInstanceOf(InvalidRuleException.class);
    }

    @Test
    @DisplayName("Should reject a blank keyword")
    void shouldRejectBlankKeyword() {
        assertThatThrownBy(() -> matcher.match(KeywordPattern.of(" "), OcrPayload.fromText("x")))
                .isInstanceOf(InvalidRuleException.class);
    }
}
