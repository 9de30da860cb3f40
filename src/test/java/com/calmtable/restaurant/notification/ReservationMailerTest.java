package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.repository.ReservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReservationMailerTest {

    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private EmailSender emailSender;

    private ReservationMailer mailer;
    private Reservation reservation;

    @BeforeEach
    void setUp() {
        mailer = new ReservationMailer(reservationRepository,
                new ReservationEmailComposer("https://calmtable.example/"), emailSender);
        reservation = new Reservation();
        reservation.setId(3L);
        reservation.setEmail("guest@calmtable.test");
        reservation.setConfirmationCode("QWER5678");
        reservation.setDate(LocalDate.of(2026, 4, 2));
        reservation.setTimeSlot(LocalTime.of(19, 30));
        reservation.setPartySize(2);
        reservation.setStatus(ReservationStatus.CONFIRMED);
    }

    @Test
    void confirmationGoesToReservationEmail() {
        when(reservationRepository.findById(3L)).thenReturn(Optional.of(reservation));

        assertThat(mailer.sendConfirmation(3L)).isTrue();

        verify(emailSender).sendHtml(eq("guest@calmtable.test"),
                eq(ReservationEmailComposer.CONFIRMATION_SUBJECT),
                contains("https://calmtable.example/reservation/QWER5678"));
    }

    @Test
    void statusUpdateReflectsStoredStatus() {
        when(reservationRepository.findById(3L)).thenReturn(Optional.of(reservation));

        assertThat(mailer.sendStatusUpdate(3L)).isTrue();

        verify(emailSender).sendHtml(eq("guest@calmtable.test"),
                eq(ReservationEmailComposer.STATUS_SUBJECT), contains("Current status: Confirmed."));
    }

    @Test
    void missingReservationSendsNothing() {
        when(reservationRepository.findById(8L)).thenReturn(Optional.empty());

        assertThat(mailer.sendConfirmation(8L)).isFalse();
        assertThat(mailer.sendStatusUpdate(8L)).isFalse();
        verify(emailSender, never()).sendHtml(anyString(), anyString(), anyString());
    }
}
