package com.invoice.mapping.entity;

import com.invoice.mapping.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExtractionPatternConverter")
class ExtractionPatternConverterTest {

    private final ExtractionPatternConverter converter = new ExtractionPatternConverter();

    @Test
    @DisplayName("Should write the method discriminator")
    void shouldWriteMethod() {
        String json = converter.convertToDatabaseColumn(RegexPattern.of("INV-(\\d+)"));

        assertThat(json).contains("\"method\":\"regex\"").contains("\"pattern\":\"INV-(\\\\d+)\"");
    }

    @Test
    @DisplayName("Should read a keyword pattern authored by an operator")
    void shouldReadKeywordPattern() {
        ExtractionPattern pattern = converter.convertToEntityAttribute(
                "{\"method\":\"keyword\",\"keyword\":\"Consignee:\",\"preprocessor\":\"uppercase\"}");

        assertThat(pattern).isEqualTo(new KeywordPattern(List.of("Consignee:"), null, null, Preprocessor.UPPERCASE));
        assertThat(pattern.method()).isEqualTo(ExtractionMethod.KEYWORD);
    }

    @Test
    @DisplayName("Should read keyword alternatives, distance and boost")
    void shouldReadKeywordAlternatives() {
        ExtractionPattern pattern = converter.convertToEntityAttribute(
                "{\"method\":\"keyword\",\"keywords\":[\"Shipper\",\"Sender\",\"From\"],"
                        + "\"maxDistance\":40,\"confidenceBoost\":5}");

        assertThat(pattern).isEqualTo(new KeywordPattern(List.of("Shipper", "Sender", "From"), 40, 5, null));
    }

    @Test
    @DisplayName("Should read the group index and boost of a regex pattern")
    void shouldReadRegexBoost() {
        ExtractionPattern pattern = converter.convertToEntityAttribute(
                "{\"method\":\"regex\",\"pattern\":\"INV-(\\\\d+)\",\"groupIndex\":1,\"confidenceBoost\":5}");

        assertThat(pattern).isEqualTo(new RegexPattern("INV-(\\d+)", "", 1, Preprocessor.NONE, 5));
    }

    @Test
    @DisplayName("Should keep keyword patterns intact through the column")
    void shouldRoundTripKeywordPattern() {
        KeywordPattern original = new KeywordPattern(List.of("Invoice Date", "Date"), 30, 5, Preprocessor.TRIM);

        assertThat(converter.convertToEntityAttribute(converter.convertToDatabaseColumn(original)))
                .isEqualTo(original);
    }

    @Test
    @DisplayName("Should treat an unknown preprocessor as none")
    void shouldIgnoreUnknownPreprocessor() {
        ExtractionPattern pattern = converter.convertToEntityAttribute(
                "{\"method\":\"regex\",\"pattern\":\"\\\\d+\",\"preprocessor\":\"titlecase\"}");

        assertThat(pattern).isInstanceOfSatisfying(RegexPattern.class,
                regex -> assertThat(regex.preprocessor()).isEqualTo(Preprocessor.NONE));
    }

    @Test
    @DisplayName("Should map blank columns to null and reject unknown methods")
    void shouldHandleBlankAndUnknown() {
        assertThat(converter.convertToEntityAttribute("  ")).isNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{\"method\":\"ml\"}"))
                .isInstanceOf(IllegalStateException.class);
    }
}
