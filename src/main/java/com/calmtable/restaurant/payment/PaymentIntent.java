package com.calmtable.restaurant.payment;

/**
 * Gateway-neutral result of a payment intent request.
 */
public record PaymentIntent(String intentId, String clientSecret) {
}
