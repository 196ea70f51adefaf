package com.invoice.mapping.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * How well one forwarder's identification patterns matched a document.
 */
@Value
@Builder
public class ForwarderMatch {
    String forwarderCode;
    String forwarderName;
    double score;              // 0..100
    @Singular
    List<String> matchedPatterns;  // 'name:DHL Express', 'format:\d{10}'
    boolean identified;
}
