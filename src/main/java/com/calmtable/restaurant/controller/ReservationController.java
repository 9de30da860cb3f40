package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.ReservationRequest;
import com.calmtable.restaurant.dto.ReservationResponse;
import com.calmtable.restaurant.dto.SlotAvailabilityResponse;
import com.calmtable.restaurant.service.ReservationService;
import com.calmtable.restaurant.service.SlotAvailabilityService;
import com.calmtable.restaurant.util.AuthenticationUtils;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ReservationController {

    private final ReservationService reservationService;
    private final SlotAvailabilityService slotAvailabilityService;

    public ReservationController(ReservationService reservationService, SlotAvailabilityService slotAvailabilityService) {
        this.reservationService = reservationService;
        this.slotAvailabilityService = slotAvailabilityService;
    }

    @PostMapping("/reservations")
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody ReservationRequest request,
                                                      Authentication authentication) {
        Long callerId = AuthenticationUtils.callerId(authentication);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ReservationResponse.from(reservationService.createReservation(callerId, request)));
    }

    @GetMapping("/reservations/{code}")
    public ResponseEntity<ReservationResponse> byCode(@PathVariable String code) {
        return ResponseEntity.ok(ReservationResponse.from(reservationService.findByConfirmationCode(code)));
    }

    @GetMapping("/my-reservations")
    public ResponseEntity<List<ReservationResponse>> mine(Authentication authentication) {
        return ResponseEntity.ok(reservationService.findForCustomer(AuthenticationUtils.callerId(authentication))
                .stream().map(ReservationResponse::from).toList());
    }

    @GetMapping("/available-slots")
    public ResponseEntity<SlotAvailabilityResponse> availableSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(slotAvailabilityService.getAvailability(date));
    }
}
