package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class ReviewNotAllowedException extends CalmTableException {

    public ReviewNotAllowedException(String message) {
        super("REVIEW_NOT_ALLOWED", HttpStatus.FORBIDDEN, message);
    }
}
