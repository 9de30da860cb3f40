package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.AnalyticsResponse;
import com.calmtable.restaurant.dto.RevenueResponse;
import com.calmtable.restaurant.exception.ValidationException;
import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderItem;
import com.calmtable.restaurant.model.OrderStatus;
import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.repository.OrderItemRepository;
import com.calmtable.restaurant.repository.OrderRepository;
import com.calmtable.restaurant.repository.ReservationRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Staff dashboard figures. Sums are computed here rather than in SQL because amounts are stored
 * as decimal text.
 */
@Service
public class AnalyticsService {

    static final int TOP_DISHES = 5;
    static final int VOLUME_DAYS = 30;
    static final int MAX_SERIES_DAYS = 90;

    private final ReservationRepository reservationRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final Clock clock;

    public AnalyticsService(ReservationRepository reservationRepository,
                            OrderRepository orderRepository,
                            OrderItemRepository orderItemRepository,
                            Clock clock) {
        this.reservationRepository = reservationRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.clock = clock;
    }

    public AnalyticsResponse summary() {
        LocalDate today = LocalDate.now(clock);

        List<Order> settled = orderRepository.findByStatusIn(OrderStatus.SETTLED);
        BigDecimal revenue = settled.stream()
                .map(Order::getTotalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);

        return new AnalyticsResponse(
                reservationRepository.countByDate(today),
                revenue,
                topDishes(settled),
                reservationVolume(today),
                ordersByStatus());
    }

    private List<AnalyticsResponse.DishCount> topDishes(List<Order> settled) {
        if (settled.isEmpty()) {
            return List.of();
        }
        List<Long> orderIds = settled.stream().map(Order::getId).toList();
        Map<String, Long> quantities = orderItemRepository.findByOrderIdIn(orderIds).stream()
                .collect(Collectors.groupingBy(OrderItem::getItemName, Collectors.summingLong(OrderItem::getQuantity)));
        return quantities.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry::getKey))
                .limit(TOP_DISHES)
                .map(entry -> new AnalyticsResponse.DishCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private List<AnalyticsResponse.DailyCount> reservationVolume(LocalDate today) {
        LocalDate start = today.minusDays(VOLUME_DAYS - 1L);
        Map<LocalDate, Long> byDate = reservationRepository.findByDateBetween(start, today).stream()
                .collect(Collectors.groupingBy(Reservation::getDate, Collectors.counting()));
        List<AnalyticsResponse.DailyCount> volume = new ArrayList<>();
        for (int offset = 0; offset < VOLUME_DAYS; offset++) {
            LocalDate day = start.plusDays(offset);
            volume.add(new AnalyticsResponse.DailyCount(day, byDate.getOrDefault(day, 0L)));
        }
        return volume;
    }

    private Map<String, Long> ordersByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (OrderStatus status : OrderStatus.values()) {
            counts.put(status.toJson(), orderRepository.countByStatus(status));
        }
        return counts;
    }

    /** Orders placed per day over the last {@code days} days, in any status, oldest day first. */
    public List<AnalyticsResponse.DailyCount> ordersPerDay(int days) {
        LocalDate today = LocalDate.now(clock);
        LocalDate start = seriesStart(today, days);
        Map<LocalDate, Long> byDay = ordersSince(start).stream()
                .collect(Collectors.groupingBy(order -> order.getCreatedAt().toLocalDate(), Collectors.counting()));
        List<AnalyticsResponse.DailyCount> series = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(today); day = day.plusDays(1)) {
            series.add(new AnalyticsResponse.DailyCount(day, byDay.getOrDefault(day, 0L)));
        }
        return series;
    }

    /** Settled revenue per day over the last {@code days} days; the total is the sum of the series. */
    public RevenueResponse revenue(int days) {
        LocalDate today = LocalDate.now(clock);
        LocalDate start = seriesStart(today, days);
        Map<LocalDate, BigDecimal> byDay = ordersSince(start).stream()
                .filter(order -> OrderStatus.SETTLED.contains(order.getStatus()))
                .collect(Collectors.groupingBy(order -> order.getCreatedAt().toLocalDate(),
                        Collectors.reducing(BigDecimal.ZERO, Order::getTotalAmount, BigDecimal::add)));
        List<RevenueResponse.DailyRevenue> series = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (LocalDate day = start; !day.isAfter(today); day = day.plusDays(1)) {
            BigDecimal amount = byDay.getOrDefault(day, BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
            series.add(new RevenueResponse.DailyRevenue(day, amount));
            total = total.add(amount);
        }
        return new RevenueResponse(days, total, series);
    }

    private static LocalDate seriesStart(LocalDate today, int days) {
        if (days < 1 || days > MAX_SERIES_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_SERIES_DAYS);
        }
        return today.minusDays(days - 1L);
    }

    private List<Order> ordersSince(LocalDate start) {
        return orderRepository.findByCreatedAtGreaterThanEqual(start.atStartOfDay()).stream()
                .filter(order -> order.getCreatedAt() != null && order.getTotalAmount() != null)
                .toList();
    }
}
