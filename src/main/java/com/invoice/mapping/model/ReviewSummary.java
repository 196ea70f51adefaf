package com.invoice.mapping.model;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSummary {
    @Min(0)
    private int fieldsReviewed;
    @Min(0)
    private int fieldsModified;
    private String notes;
}
