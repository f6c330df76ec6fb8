package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class ParameterRejectedException extends ApiException {
    public ParameterRejectedException(String reason) {
        super(HttpStatus.BAD_REQUEST, "INVALID_PARAMETERS", reason);
    }
}
