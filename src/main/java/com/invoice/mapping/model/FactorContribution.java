package com.invoice.mapping.model;

import lombok.Value;

@Value
public class FactorContribution {
    ConfidenceFactor factor;
    double weight;
    double rawScore;
    double contribution;
}
