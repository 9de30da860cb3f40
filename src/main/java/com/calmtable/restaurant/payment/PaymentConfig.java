package com.calmtable.restaurant.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PaymentConfig {

    private static final Logger logger = LoggerFactory.getLogger(PaymentConfig.class);

    @Bean
    public PaymentGateway paymentGateway(@Value("${stripe.secret-key:}") String secretKey,
                                         @Value("${stripe.currency:usd}") String currency) {
        if (secretKey == null || secretKey.isBlank()) {
            logger.warn("[PaymentConfig] stripe.secret-key not set, using development payment gateway");
            return new DevelopmentPaymentGateway();
        }
        return new StripePaymentGateway(secretKey, currency);
    }
}
