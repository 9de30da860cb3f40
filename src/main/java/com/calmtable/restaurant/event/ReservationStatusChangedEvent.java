package com.calmtable.restaurant.event;

import com.calmtable.restaurant.model.ReservationStatus;

public record ReservationStatusChangedEvent(
        Long reservationId,
        String confirmationCode,
        ReservationStatus previousStatus,
        ReservationStatus newStatus
) {
    public static ReservationStatusChangedEvent of(Long reservationId, String confirmationCode,
                                                   ReservationStatus previousStatus, ReservationStatus newStatus) {
        return new ReservationStatusChangedEvent(reservationId, confirmationCode, previousStatus, newStatus);
    }
}
