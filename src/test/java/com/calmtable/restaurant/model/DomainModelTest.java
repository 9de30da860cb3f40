package com.calmtable.restaurant.model;

import com.calmtable.restaurant.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DomainModelTest {

    @Test
    void snapshotComputesLineTotal() {
        OrderItem item = OrderItem.snapshot(1L, 2L, "Dish B", new BigDecimal("3500.00"), 2);

        assertThat(item.getLineTotal()).isEqualByComparingTo("7000");
        assertThat(item.getItemName()).isEqualTo("Dish B");
    }

    @Test
    void snapshotStoresPricesInCents() {
        OrderItem item = OrderItem.snapshot(1L, null, "Corkage", new BigDecimal("3.3"), 3);

        assertThat(item.getUnitPrice()).isEqualTo(new BigDecimal("3.30"));
        assertThat(item.getLineTotal()).isEqualTo(new BigDecimal("9.90"));
    }

    @Test
    void reservationStartsAtItsSlot() {
        Reservation reservation = new Reservation();
        reservation.setDate(LocalDate.of(2026, 3, 10));
        reservation.setTimeSlot(LocalTime.of(19, 0));

        assertThat(reservation.hasStartedBy(LocalDateTime.of(2026, 3, 10, 19, 1))).isTrue();
        assertThat(reservation.hasStartedBy(LocalDateTime.of(2026, 3, 10, 19, 0))).isFalse();
    }

    @Test
    void statusesParseCaseInsensitively() {
        assertThat(OrderStatus.fromJson("Preparing")).isEqualTo(OrderStatus.PREPARING);
        assertThat(ReservationStatus.fromJson("confirmed").toJson()).isEqualTo("confirmed");
        assertThrows(ValidationException.class, () -> OrderStatus.fromJson("shipped"));
        assertThrows(ValidationException.class, () -> MenuCategory.fromJson("brunch"));
    }

    @Test
    void settledStatusesExcludePendingAndCancelled() {
        assertThat(OrderStatus.SETTLED).doesNotContain(OrderStatus.PENDING, OrderStatus.CANCELLED);
    }
}
