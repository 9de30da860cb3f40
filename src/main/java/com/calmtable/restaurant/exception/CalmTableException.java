package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every domain failure. The code is stable and is what API clients match on.
 */
public abstract class CalmTableException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected CalmTableException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected CalmTableException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
