package com.calmtable.restaurant.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_date_slot", columnList = "reservation_date,time_slot")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    public static final int MIN_PARTY_SIZE = 1;
    public static final int MAX_PARTY_SIZE = 20;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(nullable = false)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate date;

    @Column(name = "time_slot", nullable = false)
    private LocalTime timeSlot;

    @Column(name = "party_size", nullable = false)
    private Integer partySize;

    @Column(name = "special_requests", columnDefinition = "TEXT")
    private String specialRequests;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReservationStatus status = ReservationStatus.PENDING;

    @Column(name = "confirmation_code", nullable = false, unique = true, length = 8)
    private String confirmationCode;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean hasStartedBy(LocalDateTime now) {
        return date.atTime(timeSlot).isBefore(now);
    }
}
