package com.calmtable.restaurant.model;

import com.calmtable.restaurant.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED;

    /**
     * Pending and confirmed reservations hold a seat in their slot; cancelled ones do not.
     */
    public boolean isActive() {
        return this != CANCELLED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReservationStatus fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ReservationStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown reservation status '" + value + "'");
        }
    }
}
