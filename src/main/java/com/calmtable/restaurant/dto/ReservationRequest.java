package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
public class ReservationRequest {
    @Size(max = 120)
    private String name;

    // Ignored: reservations always use the account e-mail
    private String email;

    @Size(max = 30)
    private String phone;

    @NotNull
    private LocalDate date;

    @NotNull
    @JsonProperty("time_slot")
    private LocalTime timeSlot;

    @NotNull
    @JsonProperty("party_size")
    private Integer partySize;

    @JsonProperty("special_requests")
    private String specialRequests;
}
