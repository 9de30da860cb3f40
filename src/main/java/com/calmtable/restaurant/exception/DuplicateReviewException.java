package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class DuplicateReviewException extends CalmTableException {

    public DuplicateReviewException(String message) {
        super("DUPLICATE_REVIEW", HttpStatus.CONFLICT, message);
    }

    public DuplicateReviewException(String message, Throwable cause) {
        super("DUPLICATE_REVIEW", HttpStatus.CONFLICT, message, cause);
    }
}
