package com.calmtable.restaurant.model;

import com.calmtable.restaurant.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PREPARING,
    READY,
    COMPLETED,
    CANCELLED;

    /** Statuses that count toward revenue and best-seller rankings. */
    public static final Set<OrderStatus> SETTLED = EnumSet.of(CONFIRMED, PREPARING, READY, COMPLETED);

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OrderStatus fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown order status '" + value + "'");
        }
    }
}
