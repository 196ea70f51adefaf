package com.invoice.mapping.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class BatchProcessingResult {
    List<ProcessingOutcome> processed;
    Map<String, String> failures;        // documentId -> error message

    public int total() {
        return processed.size() + failures.size();
    }
}
