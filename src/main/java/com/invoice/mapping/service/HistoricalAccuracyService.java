package com.invoice.mapping.service;

import com.invoice.mapping.entity.FieldAccuracy;
import com.invoice.mapping.model.HistoricalAccuracy;
import com.invoice.mapping.repository.FieldAccuracyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;

@Service
@Slf4j
public class HistoricalAccuracyService {

    private final FieldAccuracyRepository accuracyRepo;

    public HistoricalAccuracyService(FieldAccuracyRepository accuracyRepo) {
        this.accuracyRepo = accuracyRepo;
    }

    /**
     * Accuracy by field name. Forwarder rows take precedence over the
     * cross-forwarder rows; fields with no rows are absent.
     */
    @Transactional(readOnly = true)
    public Map<String, HistoricalAccuracy> forForwarder(String forwarderCode) {
        Map<String, HistoricalAccuracy> byField = new HashMap<>();
        for (FieldAccuracy row : accuracyRepo.findByForwarderCodeIsNull()) {
            byField.put(row.getFieldName(), toAccuracy(row));
        }
        if (forwarderCode != null) {
            for (FieldAccuracy row : accuracyRepo.findByForwarderCode(forwarderCode)) {
                byField.put(row.getFieldName(), toAccuracy(row));
            }
        }
        log.debug("Historical accuracy available for {} fields of forwarder {}", byField.size(), forwarderCode);
        return byField;
    }

    private static HistoricalAccuracy toAccuracy(FieldAccuracy row) {
        return new HistoricalAccuracy(row.getAccuracy(), row.getSampleSize());
    }
}
