package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.repository.ReservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Loads the reservation fresh at send time so the e-mail shows the stored state.
 */
@Component
public class ReservationMailer {

    private static final Logger logger = LoggerFactory.getLogger(ReservationMailer.class);

    private final ReservationRepository reservationRepository;
    private final ReservationEmailComposer composer;
    private final EmailSender emailSender;

    public ReservationMailer(ReservationRepository reservationRepository,
                             ReservationEmailComposer composer,
                             EmailSender emailSender) {
        this.reservationRepository = reservationRepository;
        this.composer = composer;
        this.emailSender = emailSender;
    }

    public boolean sendConfirmation(Long reservationId) {
        Optional<Reservation> reservation = reservationRepository.findById(reservationId);
        if (reservation.isEmpty()) {
            logger.warn("[ReservationMailer] Reservation {} not found, confirmation skipped", reservationId);
            return false;
        }
        Reservation r = reservation.get();
        emailSender.sendHtml(r.getEmail(), ReservationEmailComposer.CONFIRMATION_SUBJECT, composer.confirmationBody(r));
        return true;
    }

    public boolean sendStatusUpdate(Long reservationId) {
        Optional<Reservation> reservation = reservationRepository.findById(reservationId);
        if (reservation.isEmpty()) {
            logger.warn("[ReservationMailer] Reservation {} not found, status e-mail skipped", reservationId);
            return false;
        }
        Reservation r = reservation.get();
        emailSender.sendHtml(r.getEmail(), ReservationEmailComposer.STATUS_SUBJECT, composer.statusBody(r));
        return true;
    }
}
