package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class CapacityExceededException extends CalmTableException {

    public CapacityExceededException(String message) {
        super("CAPACITY_EXCEEDED", HttpStatus.CONFLICT, message);
    }
}
