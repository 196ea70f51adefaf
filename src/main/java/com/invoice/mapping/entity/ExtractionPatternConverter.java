package com.invoice.mapping.entity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoice.mapping.model.ExtractionPattern;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ExtractionPatternConverter implements AttributeConverter<ExtractionPattern, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(ExtractionPattern pattern) {
        if (pattern == null) return null;
        try {
            return MAPPER.writerFor(ExtractionPattern.class).writeValueAsString(pattern);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize extraction pattern", e);
        }
    }

    @Override
    public ExtractionPattern convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, ExtractionPattern.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize extraction pattern: " + json, e);
        }
    }
}
