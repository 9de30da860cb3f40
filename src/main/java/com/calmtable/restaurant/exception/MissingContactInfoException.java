package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class MissingContactInfoException extends CalmTableException {

    public MissingContactInfoException(String message) {
        super("MISSING_CONTACT_INFO", HttpStatus.BAD_REQUEST, message);
    }
}
