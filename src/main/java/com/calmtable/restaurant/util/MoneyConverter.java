package com.calmtable.restaurant.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Keeps monetary amounts as exact decimal text with two fraction digits.
 * SQLite would otherwise coerce NUMERIC columns to floating point.
 */
@Converter
public class MoneyConverter implements AttributeConverter<BigDecimal, String> {

    public static final int SCALE = 2;

    @Override
    public String convertToDatabaseColumn(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public BigDecimal convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return new BigDecimal(dbData.trim()).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
