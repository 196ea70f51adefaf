package com.invoice.mapping.model;

/**
 * Addresses a line of the OCR layout by a 1-based {@code page:row[:col]} selector.
 * The optional column picks one table cell from the line.
 */
public record PositionPattern(String selector) implements ExtractionPattern {

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.POSITION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPosition(this);
    }
}
