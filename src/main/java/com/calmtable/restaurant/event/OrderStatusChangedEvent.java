package com.calmtable.restaurant.event;

import com.calmtable.restaurant.model.OrderStatus;

import java.util.UUID;

public record OrderStatusChangedEvent(
        String eventId,
        Long orderId,
        String orderNumber,
        Long customerId,
        OrderStatus previousStatus,
        OrderStatus newStatus
) {
    public static OrderStatusChangedEvent of(Long orderId, String orderNumber, Long customerId,
                                             OrderStatus previousStatus, OrderStatus newStatus) {
        return new OrderStatusChangedEvent(UUID.randomUUID().toString(), orderId, orderNumber, customerId,
                previousStatus, newStatus);
    }
}
