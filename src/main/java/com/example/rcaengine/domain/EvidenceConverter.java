package com.example.rcaengine.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link Evidence} as a JSON column.
 */
@Converter
public class EvidenceConverter implements AttributeConverter<Evidence, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Evidence evidence) {
        if (evidence == null) return null;
        try {
            return MAPPER.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evidence", e);
        }
    }

    @Override
    public Evidence convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return new Evidence();
        try {
            return MAPPER.readValue(json, Evidence.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize evidence", e);
        }
    }
}
