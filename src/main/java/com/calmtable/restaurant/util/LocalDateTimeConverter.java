package com.calmtable.restaurant.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stores timestamps as sortable text ({@code yyyy-MM-dd HH:mm:ss.SSS}) so that SQLite
 * comparisons and ORDER BY clauses follow chronological order.
 */
@Converter(autoApply = true)
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger logger = LoggerFactory.getLogger(LocalDateTimeConverter.class);

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    @Override
    public String convertToDatabaseColumn(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }

        try {
            return LocalDateTime.parse(dbData, FORMATTER);
        } catch (DateTimeParseException e) {
            // Rows written by older builds used the ISO form with a 'T' separator
            try {
                return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
            } catch (DateTimeParseException e2) {
                logger.warn("[LocalDateTimeConverter] Failed to parse timestamp '{}': {}", dbData, e2.getMessage());
                return null;
            }
        }
    }
}
