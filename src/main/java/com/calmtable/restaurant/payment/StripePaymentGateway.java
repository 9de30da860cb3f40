package com.calmtable.restaurant.payment;

import com.stripe.exception.StripeException;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class StripePaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(StripePaymentGateway.class);
    private static final BigDecimal CENTS = new BigDecimal("100");

    private final String secretKey;
    private final String currency;

    public StripePaymentGateway(String secretKey, String currency) {
        this.secretKey = secretKey;
        this.currency = currency;
    }

    @Override
    public PaymentIntent createIntent(Long orderId, String orderNumber, BigDecimal amount) {
        long amountInCents = amount.multiply(CENTS).setScale(0, RoundingMode.HALF_UP).longValueExact();

        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(amountInCents)
                .setCurrency(currency)
                .setAutomaticPaymentMethods(
                        PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                                .setEnabled(true)
                                .build())
                .putMetadata("order_id", String.valueOf(orderId))
                .putMetadata("order_number", orderNumber)
                .build();
        RequestOptions options = RequestOptions.builder().setApiKey(secretKey).build();

        try {
            com.stripe.model.PaymentIntent intent = com.stripe.model.PaymentIntent.create(params, options);
            logger.info("[StripePaymentGateway] Created intent {} for order {}", intent.getId(), orderNumber);
            return new PaymentIntent(intent.getId(), intent.getClientSecret());
        } catch (StripeException e) {
            throw new PaymentException("Stripe rejected payment intent for order " + orderNumber, e);
        }
    }
}
