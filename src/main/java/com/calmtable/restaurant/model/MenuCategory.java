package com.calmtable.restaurant.model;

import com.calmtable.restaurant.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MenuCategory {
    STARTERS,
    MAINS,
    DESSERTS,
    DRINKS;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MenuCategory fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return MenuCategory.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown menu category '" + value + "'");
        }
    }
}
