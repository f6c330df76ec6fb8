package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class ScopeNotFoundException extends ApiException {
    public ScopeNotFoundException(UUID id) {
        super(HttpStatus.NOT_FOUND, "SCOPE_NOT_FOUND", "Scope not found with id: " + id);
    }
}
