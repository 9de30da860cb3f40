package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.dispatch.InlineTaskDispatcher;
import com.calmtable.restaurant.event.OrderPlacedEvent;
import com.calmtable.restaurant.event.ReservationCreatedEvent;
import com.calmtable.restaurant.event.ReservationStatusChangedEvent;
import com.calmtable.restaurant.model.ReservationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationEventListenerTest {

    @Mock
    private NotificationService notificationService;
    @Mock
    private ReservationMailer reservationMailer;

    private NotificationEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new NotificationEventListener(notificationService, reservationMailer, new InlineTaskDispatcher());
    }

    @Test
    void fanOutFailureIsContained() {
        when(notificationService.recordOrderPlaced(any())).thenThrow(new IllegalStateException("disk full"));

        assertThatCode(() -> listener.onOrderPlaced(
                OrderPlacedEvent.of(1L, "CT-00000001", 2L, "Jo", BigDecimal.TEN, 1)))
                .doesNotThrowAnyException();
    }

    @Test
    void mailFailureIsContained() {
        when(reservationMailer.sendConfirmation(4L)).thenThrow(new IllegalStateException("smtp down"));

        assertThatCode(() -> listener.onReservationCreated(ReservationCreatedEvent.of(4L, "ABCD1234")))
                .doesNotThrowAnyException();
        verify(reservationMailer).sendConfirmation(4L);
    }

    @Test
    void statusChangeSendsStatusMail() {
        listener.onReservationStatusChanged(ReservationStatusChangedEvent.of(4L, "ABCD1234",
                ReservationStatus.PENDING, ReservationStatus.CONFIRMED));

        verify(reservationMailer).sendStatusUpdate(4L);
    }
}
