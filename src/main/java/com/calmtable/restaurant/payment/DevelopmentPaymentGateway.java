package com.calmtable.restaurant.payment;

import java.math.BigDecimal;

/**
 * Used when no Stripe key is configured. The client secret is recognisable by the front end.
 */
public class DevelopmentPaymentGateway implements PaymentGateway {

    @Override
    public PaymentIntent createIntent(Long orderId, String orderNumber, BigDecimal amount) {
        return new PaymentIntent(null, "test_client_secret_order_" + orderId);
    }
}
