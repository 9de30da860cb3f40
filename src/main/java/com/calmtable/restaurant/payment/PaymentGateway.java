package com.calmtable.restaurant.payment;

import java.math.BigDecimal;

public interface PaymentGateway {

    /**
     * Creates a payment intent for the given order total.
     *
     * @throws PaymentException when the gateway refuses or cannot be reached
     */
    PaymentIntent createIntent(Long orderId, String orderNumber, BigDecimal amount);
}
