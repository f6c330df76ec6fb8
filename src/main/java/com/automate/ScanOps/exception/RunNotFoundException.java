package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class RunNotFoundException extends ApiException {
    public RunNotFoundException(UUID id) {
        super(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND", "Run not found with id: " + id);
    }
}
