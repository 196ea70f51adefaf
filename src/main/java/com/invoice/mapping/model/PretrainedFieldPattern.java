package com.invoice.mapping.model;

/**
 * Reads a field the OCR service extracted itself, by the service's own field name.
 */
public record PretrainedFieldPattern(String name) implements ExtractionPattern {

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.PRETRAINED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPretrained(this);
    }
}
