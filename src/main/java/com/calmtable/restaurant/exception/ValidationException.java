package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends CalmTableException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message);
    }
}
