package com.calmtable.restaurant.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenRoleException extends CalmTableException {

    public ForbiddenRoleException(String message) {
        super("FORBIDDEN_ROLE", HttpStatus.FORBIDDEN, message);
    }
}
