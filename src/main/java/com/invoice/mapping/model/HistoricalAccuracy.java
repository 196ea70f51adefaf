package com.invoice.mapping.model;

import lombok.Value;

/**
 * Observed reviewer agreement for one forwarder+field, 0..100, and how many
 * reviewed documents it is based on.
 */
@Value
public class HistoricalAccuracy {
    double accuracy;
    int sampleSize;
}
