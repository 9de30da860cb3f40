package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.ReservationRequest;
import com.calmtable.restaurant.event.ReservationCreatedEvent;
import com.calmtable.restaurant.event.ReservationStatusChangedEvent;
import com.calmtable.restaurant.exception.CapacityExceededException;
import com.calmtable.restaurant.exception.NotFoundException;
import com.calmtable.restaurant.exception.PastSlotException;
import com.calmtable.restaurant.exception.ValidationException;
import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.ReservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
public class ReservationService {

    private static final Logger logger = LoggerFactory.getLogger(ReservationService.class);

    static final Set<ReservationStatus> ACTIVE_STATUSES = EnumSet.of(ReservationStatus.PENDING, ReservationStatus.CONFIRMED);
    private static final int MAX_CODE_ATTEMPTS = 5;

    private final ReservationRepository reservationRepository;
    private final SlotCatalog slotCatalog;
    private final ConfirmationCodeGenerator codeGenerator;
    private final LockedTransactionRunner transactionRunner;
    private final CallerResolver callerResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReservationService(ReservationRepository reservationRepository,
                              SlotCatalog slotCatalog,
                              ConfirmationCodeGenerator codeGenerator,
                              LockedTransactionRunner transactionRunner,
                              CallerResolver callerResolver,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock) {
        this.reservationRepository = reservationRepository;
        this.slotCatalog = slotCatalog;
        this.codeGenerator = codeGenerator;
        this.transactionRunner = transactionRunner;
        this.callerResolver = callerResolver;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Reservation createReservation(Long callerId, ReservationRequest request) {
        User customer = callerResolver.requireCustomer(callerId, "create reservations");
        validate(request);

        LocalDate date = request.getDate();
        LocalTime slot = request.getTimeSlot();
        String lockKey = "slot:" + date + ":" + SlotCatalog.label(slot);

        for (int attempt = 1; ; attempt++) {
            try {
                Reservation saved = transactionRunner.execute(lockKey, () -> insertWithinCapacity(customer, request));
                logger.info("[ReservationService] Reservation {} created for {} {} (party of {})",
                        saved.getConfirmationCode(), date, SlotCatalog.label(slot), saved.getPartySize());
                return saved;
            } catch (DataIntegrityViolationException e) {
                // Confirmation code raced with another insert; the transaction rolled back so retry cleanly
                if (attempt >= MAX_CODE_ATTEMPTS) {
                    throw e;
                }
                logger.warn("[ReservationService] Confirmation code collision, retrying ({}/{})", attempt, MAX_CODE_ATTEMPTS);
            }
        }
    }

    private Reservation insertWithinCapacity(User customer, ReservationRequest request) {
        long active = reservationRepository.countByDateAndTimeSlotAndStatusIn(
                request.getDate(), request.getTimeSlot(), ACTIVE_STATUSES);
        if (active >= slotCatalog.maxPerSlot()) {
            throw new CapacityExceededException("This time slot is fully booked. Please choose another slot.");
        }

        Reservation reservation = new Reservation();
        reservation.setUserId(customer.getId());
        reservation.setName(hasText(request.getName()) ? request.getName().trim() : customer.getFullName());
        reservation.setEmail(customer.getEmail());
        reservation.setPhone(hasText(request.getPhone()) ? request.getPhone().trim() : customer.getPhone());
        reservation.setDate(request.getDate());
        reservation.setTimeSlot(request.getTimeSlot());
        reservation.setPartySize(request.getPartySize());
        reservation.setSpecialRequests(request.getSpecialRequests());
        reservation.setStatus(ReservationStatus.PENDING);
        reservation.setConfirmationCode(nextUnusedCode());
        reservation.setCreatedAt(LocalDateTime.now(clock));

        Reservation saved = reservationRepository.save(reservation);
        eventPublisher.publishEvent(ReservationCreatedEvent.of(saved.getId(), saved.getConfirmationCode()));
        return saved;
    }

    private String nextUnusedCode() {
        String code = codeGenerator.generate();
        while (reservationRepository.existsByConfirmationCode(code)) {
            code = codeGenerator.generate();
        }
        return code;
    }

    private void validate(ReservationRequest request) {
        if (request.getDate() == null) {
            throw new ValidationException("Reservation date is required");
        }
        if (request.getPartySize() == null
                || request.getPartySize() < Reservation.MIN_PARTY_SIZE
                || request.getPartySize() > Reservation.MAX_PARTY_SIZE) {
            throw new ValidationException("Party size must be between " + Reservation.MIN_PARTY_SIZE
                    + " and " + Reservation.MAX_PARTY_SIZE);
        }
        if (!slotCatalog.contains(request.getTimeSlot())) {
            throw new ValidationException("Invalid time slot");
        }

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        LocalDate today = now.toLocalDate();
        if (request.getDate().isBefore(today)) {
            throw new PastSlotException("Reservation date cannot be in the past");
        }
        if (request.getDate().isEqual(today) && !request.getTimeSlot().isAfter(now.toLocalTime())) {
            throw new PastSlotException("Selected time slot has already passed");
        }
    }

    /**
     * Staff override: the new status is written as-is, with no capacity re-check and no
     * transition rules.
     */
    public Reservation updateReservationStatus(Long reservationId, ReservationStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        return transactionRunner.execute("reservation:" + reservationId, () -> {
            Reservation reservation = reservationRepository.findById(reservationId)
                    .orElseThrow(() -> new NotFoundException("Reservation not found"));
            ReservationStatus previous = reservation.getStatus();
            if (previous == newStatus) {
                return reservation;
            }
            reservation.setStatus(newStatus);
            Reservation saved = reservationRepository.save(reservation);
            eventPublisher.publishEvent(ReservationStatusChangedEvent.of(
                    saved.getId(), saved.getConfirmationCode(), previous, newStatus));
            logger.info("[ReservationService] Reservation {} status {} -> {}",
                    saved.getConfirmationCode(), previous, newStatus);
            return saved;
        });
    }

    public Reservation findByConfirmationCode(String code) {
        if (!hasText(code)) {
            throw new NotFoundException("Reservation not found");
        }
        return reservationRepository.findByConfirmationCode(code.trim().toUpperCase())
                .orElseThrow(() -> new NotFoundException("Reservation not found"));
    }

    public List<Reservation> findForCustomer(Long callerId) {
        User user = callerResolver.requireUser(callerId);
        return reservationRepository.findOwnedOrMatchingEmail(user.getId(), user.getEmail());
    }

    public List<Reservation> listForStaff(LocalDate date, ReservationStatus status) {
        if (date != null) {
            return reservationRepository.findByDateOrderByTimeSlotAsc(date).stream()
                    .filter(r -> status == null || r.getStatus() == status)
                    .toList();
        }
        if (status != null) {
            return reservationRepository.findByStatusOrderByDateDescTimeSlotDesc(status);
        }
        return reservationRepository.findAllByOrderByDateDescTimeSlotDesc();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
