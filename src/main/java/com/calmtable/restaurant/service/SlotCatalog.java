package com.calmtable.restaurant.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bookable time slots in display order and the number of active reservations each may hold.
 */
@Component
public class SlotCatalog {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final List<LocalTime> slots;
    private final int maxPerSlot;

    public SlotCatalog(@Value("${reservation.slots:17:00,17:30,18:00,18:30,19:00,19:30,20:00,20:30,21:00}") String slots,
                       @Value("${reservation.max-per-slot:3}") int maxPerSlot) {
        if (maxPerSlot < 1) {
            throw new IllegalArgumentException("reservation.max-per-slot must be at least 1");
        }
        List<LocalTime> parsed = new ArrayList<>();
        for (String raw : slots.split(",")) {
            String value = raw.trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                LocalTime slot = LocalTime.parse(value);
                if (!parsed.contains(slot)) {
                    parsed.add(slot);
                }
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid reservation slot '" + value + "'", e);
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("reservation.slots must list at least one slot");
        }
        this.slots = Collections.unmodifiableList(parsed);
        this.maxPerSlot = maxPerSlot;
    }

    public List<LocalTime> slots() {
        return slots;
    }

    public int maxPerSlot() {
        return maxPerSlot;
    }

    public boolean contains(LocalTime slot) {
        return slot != null && slots.contains(slot);
    }

    public static String label(LocalTime slot) {
        return slot.format(LABEL_FORMAT);
    }
}
