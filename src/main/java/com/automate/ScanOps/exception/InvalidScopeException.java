package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class InvalidScopeException extends ApiException {
    public InvalidScopeException(String reason) {
        super(HttpStatus.BAD_REQUEST, "INVALID_SCOPE", reason);
    }
}
