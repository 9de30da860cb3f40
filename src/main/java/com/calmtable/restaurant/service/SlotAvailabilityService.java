package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.SlotAvailabilityResponse;
import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.repository.ReservationRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class SlotAvailabilityService {

    private final ReservationRepository reservationRepository;
    private final SlotCatalog slotCatalog;
    private final Clock clock;

    public SlotAvailabilityService(ReservationRepository reservationRepository, SlotCatalog slotCatalog, Clock clock) {
        this.reservationRepository = reservationRepository;
        this.slotCatalog = slotCatalog;
        this.clock = clock;
    }

    /**
     * Splits the catalog slots of a date into bookable and full ones. Past dates yield two empty
     * lists; on today, slots at or before the current minute are left out of both.
     */
    public SlotAvailabilityResponse getAvailability(LocalDate date) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
        List<String> available = new ArrayList<>();
        List<String> full = new ArrayList<>();

        if (date.isBefore(now.toLocalDate())) {
            return new SlotAvailabilityResponse(date, available, full, slotCatalog.maxPerSlot());
        }

        Map<LocalTime, Long> activeBySlot = reservationRepository
                .findByDateAndStatusIn(date, ReservationService.ACTIVE_STATUSES).stream()
                .collect(Collectors.groupingBy(Reservation::getTimeSlot, Collectors.counting()));
        boolean today = date.isEqual(now.toLocalDate());

        for (LocalTime slot : slotCatalog.slots()) {
            if (today && !slot.isAfter(now.toLocalTime())) {
                continue;
            }
            long active = activeBySlot.getOrDefault(slot, 0L);
            if (active >= slotCatalog.maxPerSlot()) {
                full.add(SlotCatalog.label(slot));
            } else {
                available.add(SlotCatalog.label(slot));
            }
        }
        return new SlotAvailabilityResponse(date, available, full, slotCatalog.maxPerSlot());
    }
}
