package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class PastSlotException extends CalmTableException {

    public PastSlotException(String message) {
        super("PAST_SLOT", HttpStatus.BAD_REQUEST, message);
    }
}
