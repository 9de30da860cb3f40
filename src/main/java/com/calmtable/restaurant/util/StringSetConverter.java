package com.calmtable.restaurant.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSON array column for tag sets such as dietary tags.
 */
@Converter
public class StringSetConverter implements AttributeConverter<Set<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashSet<String>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Set<String> values) {
        try {
            return MAPPER.writeValueAsString(values == null ? Set.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize tag set", e);
        }
    }

    @Override
    public Set<String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new LinkedHashSet<>();
        }
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not read tag set: " + dbData, e);
        }
    }
}
