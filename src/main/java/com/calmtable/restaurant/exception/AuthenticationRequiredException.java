package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends CalmTableException {

    public AuthenticationRequiredException(String message) {
        super("AUTH_REQUIRED", HttpStatus.UNAUTHORIZED, message);
    }

    public AuthenticationRequiredException() {
        this("Authentication required");
    }
}
