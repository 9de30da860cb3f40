package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class InvalidCartItemException extends CalmTableException {

    public InvalidCartItemException(String message) {
        super("INVALID_CART_ITEM", HttpStatus.BAD_REQUEST, message);
    }
}
