package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.service.SlotCatalog;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class ReservationResponse {
    private Long id;
    private String name;
    private String email;
    private String phone;
    private LocalDate date;

    @JsonProperty("time_slot")
    private String timeSlot;

    @JsonProperty("party_size")
    private Integer partySize;

    @JsonProperty("special_requests")
    private String specialRequests;

    private ReservationStatus status;

    @JsonProperty("confirmation_code")
    private String confirmationCode;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static ReservationResponse from(Reservation reservation) {
        ReservationResponse response = new ReservationResponse();
        response.setId(reservation.getId());
        response.setName(reservation.getName());
        response.setEmail(reservation.getEmail());
        response.setPhone(reservation.getPhone());
        response.setDate(reservation.getDate());
        response.setTimeSlot(SlotCatalog.label(reservation.getTimeSlot()));
        response.setPartySize(reservation.getPartySize());
        response.setSpecialRequests(reservation.getSpecialRequests());
        response.setStatus(reservation.getStatus());
        response.setConfirmationCode(reservation.getConfirmationCode());
        response.setCreatedAt(reservation.getCreatedAt());
        return response;
    }
}
