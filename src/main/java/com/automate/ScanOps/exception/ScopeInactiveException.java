package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class ScopeInactiveException extends ApiException {
    public ScopeInactiveException(UUID id) {
        super(HttpStatus.CONFLICT, "SCOPE_INACTIVE", "Scope " + id + " is not active");
    }
}
