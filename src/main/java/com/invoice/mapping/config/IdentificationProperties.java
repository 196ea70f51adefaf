package com.invoice.mapping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scores for recognising which forwarder issued an invoice.
 */
@Data
@Component
@ConfigurationProperties(prefix = "invoice.identification")
public class IdentificationProperties {
    private double nameMatchScore = 40.0;
    private double keywordMatchScore = 15.0;
    private double keywordMatchMax = 30.0;
    private double formatMatchScore = 20.0;
    private double bonusPerExtraMatch = 5.0;
    /** Minimum score for a forwarder to be taken as identified. */
    private double identifyThreshold = 50.0;
}
