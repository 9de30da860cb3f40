package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.ReservationRequest;
import com.calmtable.restaurant.exception.CapacityExceededException;
import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.AdminNotificationRepository;
import com.calmtable.restaurant.repository.ReservationRepository;
import com.calmtable.restaurant.repository.ReviewRepository;
import com.calmtable.restaurant.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
class ReservationConcurrencyIntegrationTest {

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private SlotAvailabilityService slotAvailabilityService;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private ReviewRepository reviewRepository;

    @Autowired
    private AdminNotificationRepository notificationRepository;

    @Autowired
    private UserRepository userRepository;

    private final LocalDate nextWeek = LocalDate.now(ZoneOffset.UTC).plusDays(7);

    @BeforeEach
    void cleanDatabase() {
        notificationRepository.deleteAll();
        reviewRepository.deleteAll();
        reservationRepository.deleteAll();
    }

    private User customer() {
        User user = new User();
        user.setEmail(UUID.randomUUID() + "@calmtable.test");
        user.setPassword("secret");
        user.setFirstName("Integration");
        user.setLastName("Guest");
        user.setRole(User.ROLE_CUSTOMER);
        return userRepository.save(user);
    }

    private ReservationRequest request(String slot) {
        ReservationRequest request = new ReservationRequest();
        request.setDate(nextWeek);
        request.setTimeSlot(LocalTime.parse(slot));
        request.setPartySize(2);
        return request;
    }

    @Test
    void fullSlotRejectsFourthBookingButNextSlotAccepts() {
        for (int i = 0; i < 3; i++) {
            reservationService.createReservation(customer().getId(), request("19:00"));
        }
        Long latecomer = customer().getId();

        assertThrows(CapacityExceededException.class,
                () -> reservationService.createReservation(latecomer, request("19:00")));
        Reservation accepted = reservationService.createReservation(latecomer, request("19:30"));

        assertThat(accepted.getStatus()).isEqualTo(ReservationStatus.PENDING);
        assertThat(slotAvailabilityService.getAvailability(nextWeek).getFullSlots()).containsExactly("19:00");
    }

    @Test
    void cancelledReservationFreesCapacity() {
        List<Reservation> booked = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            booked.add(reservationService.createReservation(customer().getId(), request("20:00")));
        }
        reservationService.updateReservationStatus(booked.get(0).getId(), ReservationStatus.CANCELLED);

        Reservation replacement = reservationService.createReservation(customer().getId(), request("20:00"));

        assertThat(replacement.getId()).isNotNull();
        assertThat(reservationRepository.countByDateAndTimeSlotAndStatusIn(nextWeek, LocalTime.of(20, 0),
                ReservationService.ACTIVE_STATUSES)).isEqualTo(3);
    }

    @Test
    void concurrentBookingsNeverOverfillSlot() throws Exception {
        int threads = 10;
        List<Long> customers = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            customers.add(customer().getId());
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        List<Future<Boolean>> results = new ArrayList<>();
        for (Long customerId : customers) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    reservationService.createReservation(customerId, request("18:30"));
                    return true;
                } catch (CapacityExceededException e) {
                    rejected.incrementAndGet();
                    return false;
                }
            }));
        }
        start.countDown();

        int accepted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(60, TimeUnit.SECONDS)) {
                accepted++;
            }
        }
        pool.shutdown();

        assertThat(accepted).isEqualTo(3);
        assertThat(rejected).hasValue(7);
        assertThat(reservationRepository.countByDateAndTimeSlotAndStatusIn(nextWeek, LocalTime.of(18, 30),
                ReservationService.ACTIVE_STATUSES)).isEqualTo(3);
    }

    @Test
    void confirmationCodeFindsStoredReservation() {
        Reservation created = reservationService.createReservation(customer().getId(), request("17:00"));

        Reservation found = reservationService.findByConfirmationCode(created.getConfirmationCode().toLowerCase());

        assertThat(found.getId()).isEqualTo(created.getId());
        assertThat(found.getConfirmationCode()).matches("[A-Z0-9]{8}");
    }
}
