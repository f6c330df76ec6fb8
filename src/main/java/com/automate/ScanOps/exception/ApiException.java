package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Rejection with a stable machine readable code next to the display reason.
 */
public abstract class ApiException extends ResponseStatusException {

    private final String code;

    protected ApiException(HttpStatus status, String code, String reason) {
        super(status, reason);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
