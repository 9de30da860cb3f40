package com.calmtable.restaurant.util;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;

public final class AuthenticationUtils {

    private AuthenticationUtils() {
    }

    /**
     * User id carried by a JWT-backed authentication, or {@code null} for anonymous callers.
     */
    public static Long callerId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken
                || authentication.getName() == null) {
            return null;
        }
        try {
            return Long.parseLong(authentication.getName());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
