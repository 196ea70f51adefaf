package com.invoice.mapping.service;

import com.invoice.mapping.entity.FieldAccuracy;
import com.invoice.mapping.model.HistoricalAccuracy;
import com.invoice.mapping.repository.FieldAccuracyRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HistoricalAccuracyService")
class HistoricalAccuracyServiceTest {

    @Mock
    private FieldAccuracyRepository accuracyRepo;

    @InjectMocks
    private HistoricalAccuracyService service;

    private static FieldAccuracy row(String forwarder, String field, double accuracy, int samples) {
        return FieldAccuracy.builder()
                .forwarderCode(forwarder)
                .fieldName(field)
                .accuracy(accuracy)
                .sampleSize(samples)
                .build();
    }

    @Test
    @DisplayName("Should let forwarder rows override universal rows")
    void shouldPreferForwarderRows() {
        when(accuracyRepo.findByForwarderCodeIsNull()).thenReturn(List.of(
                row(null, "invoiceNumber", 80, 500),
                row(null, "currency", 99, 500)));
        when(accuracyRepo.findByForwarderCode("DHL")).thenReturn(List.of(
                row("DHL", "invoiceNumber", 96, 40)));

        Map<String, HistoricalAccuracy> accuracy = service.forForwarder("DHL");

        assertThat(accuracy).containsEntry("invoiceNumber", new HistoricalAccuracy(96, 40));
        assertThat(accuracy).containsEntry("currency", new HistoricalAccuracy(99, 500));
    }

    @Test
    @DisplayName("Should use universal rows only without a forwarder")
    void shouldUseUniversalRowsOnly() {
        when(accuracyRepo.findByForwarderCodeIsNull()).thenReturn(List.of());

        assertThat(service.forForwarder(null)).isEmpty();
        verify(accuracyRepo, never()).findByForwarderCode(null);
    }
}
