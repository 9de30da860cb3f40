package com.calmtable.restaurant.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtServiceTest {

    private static final String SECRET = "calm-table-test-secret-key-that-is-long-enough";
    private static final Instant ISSUED = Instant.parse("2026-03-10T12:00:00Z");

    @Test
    void tokenCarriesUserIdAndRole() {
        JwtService jwtService = new JwtService(SECRET, 60_000, Clock.fixed(ISSUED, ZoneOffset.UTC));

        String token = jwtService.generateToken(42L, "guest@calmtable.test", "customer");

        assertThat(jwtService.isTokenValid(token)).isTrue();
        assertThat(jwtService.extractUserId(token)).isEqualTo("42");
        assertThat(jwtService.extractRole(token)).isEqualTo("customer");
    }

    @Test
    void expiredOrForeignTokensAreInvalid() {
        JwtService issuer = new JwtService(SECRET, 60_000, Clock.fixed(ISSUED, ZoneOffset.UTC));
        String token = issuer.generateToken(42L, "guest@calmtable.test", "customer");

        JwtService otherKey = new JwtService("another-secret-key-that-is-also-long-enough", 60_000,
                Clock.fixed(ISSUED, ZoneOffset.UTC));

        assertThat(otherKey.isTokenValid(token)).isFalse();
        assertThat(issuer.isTokenValid("not-a-token")).isFalse();

        JwtService later = new JwtService(SECRET, 60_000, Clock.fixed(ISSUED.plus(Duration.ofMinutes(5)), ZoneOffset.UTC));
        assertThat(later.isTokenValid(token)).isFalse();
    }

    @Test
    void shortSecretIsRejected() {
        assertThrows(IllegalStateException.class, () -> new JwtService("too-short", 60_000, Clock.systemUTC()));
    }
}
