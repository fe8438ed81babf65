package com.alerting.aggregation.persistence.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stores strategy match rules (OR-list of AND-lists of conditions) as JSON text.
 */
@Converter
public class MatchRulesConverter implements AttributeConverter<List<List<Map<String, Object>>>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<List<Map<String, Object>>>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<List<Map<String, Object>>> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize match rules", e);
        }
    }

    @Override
    public List<List<Map<String, Object>>> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize match rules", e);
        }
    }
}
