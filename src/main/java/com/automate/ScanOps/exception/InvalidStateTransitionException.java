package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateTransitionException extends ApiException {

    public static final String CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String reason) {
        super(HttpStatus.CONFLICT, CODE, reason);
    }
}
