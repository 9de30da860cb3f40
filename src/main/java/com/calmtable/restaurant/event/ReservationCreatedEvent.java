package com.calmtable.restaurant.event;

public record ReservationCreatedEvent(Long reservationId, String confirmationCode) {

    public static ReservationCreatedEvent of(Long reservationId, String confirmationCode) {
        return new ReservationCreatedEvent(reservationId, confirmationCode);
    }
}
