package com.invoice.mapping.service.matcher;

import com.invoice.mapping.config.ConfidenceProperties;
import com.invoice.mapping.exception.InvalidRuleException;
import com.invoice.mapping.model.*;
import com.invoice.mapping.model.OcrPayload.PretrainedField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PretrainedFieldMatcher")
class PretrainedFieldMatcherTest {

    private final PretrainedFieldMatcher matcher = new PretrainedFieldMatcher(new ConfidenceProperties());

    private OcrPayload payloadWith(Map<String, PretrainedField> fields) {
        return OcrPayload.builder().text("").pretrainedFields(new LinkedHashMap<>(fields)).build();
    }

    @Test
    @DisplayName("Should scale the service confidence to 0..100")
    void shouldScaleConfidence() {
        OcrPayload payload = payloadWith(Map.of("InvoiceId", new PretrainedField("INV-9", 0.934)));

        CandidateMatch match = matcher.matchStandardField(StandardField.INVOICE_NUMBER, payload).orElseThrow();

        assertThat(match.getValue()).isEqualTo("INV-9");
        assertThat(match.getConfidence()).isEqualTo(93);
        assertThat(match.getMethod()).isEqualTo(ExtractionMethod.PRETRAINED);
    }

    @Test
    @DisplayName("Should fall back to the configured confidence when none is reported")
    void shouldUseDefaultConfidence() {
        OcrPayload payload = payloadWith(Map.of("InvoiceTotal", new PretrainedField("100.00", null)));

        assertThat(matcher.matchStandardField(StandardField.TOTAL_AMOUNT, payload))
                .map(CandidateMatch::getConfidence)
                .contains(90);
    }

    @Test
    @DisplayName("Should match the service field name case-insensitively")
    void shouldMatchIgnoringCase() {
        OcrPayload payload = payloadWith(Map.of("vendorname", new PretrainedField("DHL", 1.0)));

        assertThat(matcher.matchStandardField(StandardField.FORWARDER_NAME, payload))
                .map(CandidateMatch::getConfidence)
                .contains(100);
    }

    @Test
    @DisplayName("Should ignore fields without a counterpart or with a blank value")
    void shouldIgnoreUnmappedAndBlank() {
        OcrPayload payload = payloadWith(Map.of(
                "InvoiceId", new PretrainedField("  ", 0.99),
                "ShipperName", new PretrainedField("Acme", 0.99)));

        assertThat(matcher.matchStandardField(StandardField.INVOICE_NUMBER, payload)).isEmpty();
        assertThat(matcher.matchStandardField(StandardField.SHIPPER_NAME, payload)).isEmpty();
    }

    @Test
    @DisplayName("Should resolve an explicit pretrained rule by name")
    void shouldMatchExplicitRule() {
        OcrPayload payload = payloadWith(Map.of("ShipperName", new PretrainedField("Acme", 0.8)));

        assertThat(matcher.match(new PretrainedFieldPattern("ShipperName"), payload))
                .map(CandidateMatch::getValue)
                .contains("Acme");
        assertThatThrownBy(() -> matcher.match(new PretrainedFieldPattern(""), payload))
                .isInstanceOf(InvalidRuleException.class);
    }
}
