package com.purchasingpower.bookflow.model.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores embedding vectors as JSON arrays so the schema stays portable
 * between PostgreSQL and H2.
 */
@Converter
public class VectorJsonConverter implements AttributeConverter<List<Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Double> vector) {
        if (vector == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize embedding vector", e);
        }
    }

    @Override
    public List<Double> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, VECTOR_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialize embedding vector", e);
        }
    }
}
