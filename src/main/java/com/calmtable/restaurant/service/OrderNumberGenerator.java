package com.calmtable.restaurant.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class OrderNumberGenerator {

    static final String PREFIX = "CT-";

    /** {@code CT-} followed by eight uppercase hex digits. */
    public String generate() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
    }
}
