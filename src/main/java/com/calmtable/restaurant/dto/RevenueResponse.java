package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@AllArgsConstructor
public class RevenueResponse {

    private int days;

    @JsonProperty("total_revenue")
    private BigDecimal totalRevenue;

    private List<DailyRevenue> daily;

    @Data
    @AllArgsConstructor
    public static class DailyRevenue {
        private LocalDate date;
        private BigDecimal revenue;
    }
}
