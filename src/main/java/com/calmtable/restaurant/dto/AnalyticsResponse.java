package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class AnalyticsResponse {

    @JsonProperty("today_reservations")
    private long todayReservations;

    @JsonProperty("total_revenue")
    private BigDecimal totalRevenue;

    @JsonProperty("top_dishes")
    private List<DishCount> topDishes;

    @JsonProperty("reservation_volume")
    private List<DailyCount> reservationVolume;

    @JsonProperty("orders_by_status")
    private Map<String, Long> ordersByStatus;

    @Data
    @AllArgsConstructor
    public static class DishCount {
        @JsonProperty("item_name")
        private String itemName;

        private long quantity;
    }

    @Data
    @AllArgsConstructor
    public static class DailyCount {
        private LocalDate date;
        private long count;
    }
}
