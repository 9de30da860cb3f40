package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
@AllArgsConstructor
public class SlotAvailabilityResponse {
    private LocalDate date;

    @JsonProperty("available_slots")
    private List<String> availableSlots;

    @JsonProperty("full_slots")
    private List<String> fullSlots;

    @JsonProperty("max_reservations_per_slot")
    private int maxReservationsPerSlot;
}
