package com.calmtable.restaurant.event;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Published once per successful checkout call. {@code checkoutId} is unique per call, so two
 * checkouts that land on the same pending order still produce two distinct events.
 */
public record OrderPlacedEvent(
        String checkoutId,
        Long orderId,
        String orderNumber,
        Long customerId,
        String customerName,
        BigDecimal totalAmount,
        int addedLines
) {
    public static OrderPlacedEvent of(Long orderId, String orderNumber, Long customerId, String customerName,
                                      BigDecimal totalAmount, int addedLines) {
        return new OrderPlacedEvent(UUID.randomUUID().toString(), orderId, orderNumber, customerId,
                customerName, totalAmount, addedLines);
    }
}
