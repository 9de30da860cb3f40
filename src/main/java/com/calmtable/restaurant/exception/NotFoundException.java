package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends CalmTableException {

    public NotFoundException(String message) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }
}
