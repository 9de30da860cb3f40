package com.calmtable.restaurant.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    NEW_ORDER,
    STATUS_UPDATE,
    GENERAL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
