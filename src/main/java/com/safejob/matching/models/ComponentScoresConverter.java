package com.safejob.matching.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safejob.matching.dto.enums.ScoreComponent;
import com.safejob.matching.exceptions.InternalServerErrorException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Stores the frozen component scores of an application as a JSON text column.
 */
@Converter
public class ComponentScoresConverter implements AttributeConverter<Map<ScoreComponent, Double>, String> {
    private static final ObjectMapper om = new ObjectMapper();
    private static final TypeReference<Map<ScoreComponent, Double>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<ScoreComponent, Double> attribute) {
        if (attribute == null) return null;
        try {
            return om.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed to serialise component scores", e);
        }
    }

    @Override
    public Map<ScoreComponent, Double> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;
        try {
            Map<ScoreComponent, Double> parsed = om.readValue(dbData, TYPE);
            return parsed.isEmpty() ? parsed : new EnumMap<>(parsed);
        } catch (JsonProcessingException e) {
            throw new InternalServerErrorException("Failed to read component scores", e);
        }
    }
}
