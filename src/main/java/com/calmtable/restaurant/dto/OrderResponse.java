package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderItem;
import com.calmtable.restaurant.model.OrderStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
public class OrderResponse {
    private Long id;

    @JsonProperty("order_number")
    private String orderNumber;

    private OrderStatus status;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_email")
    private String customerEmail;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    private String notes;

    private List<OrderItemDto> items;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("client_secret")
    private String clientSecret;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static OrderResponse from(Order order, List<OrderItem> items) {
        OrderResponse response = new OrderResponse();
        response.setId(order.getId());
        response.setOrderNumber(order.getOrderNumber());
        response.setStatus(order.getStatus());
        response.setCustomerName(order.getCustomerName());
        response.setCustomerEmail(order.getCustomerEmail());
        response.setTotalAmount(order.getTotalAmount());
        response.setNotes(order.getNotes());
        response.setItems(items.stream().map(OrderItemDto::from).toList());
        response.setCreatedAt(order.getCreatedAt());
        response.setUpdatedAt(order.getUpdatedAt());
        return response;
    }
}
