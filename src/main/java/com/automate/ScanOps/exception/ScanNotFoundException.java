package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

// smart-scan session lookup miss, also used when the caller does not own it
public class ScanNotFoundException extends ApiException {
    public ScanNotFoundException(UUID id) {
        super(HttpStatus.NOT_FOUND, "SCAN_NOT_FOUND", "Scan not found with id: " + id);
    }
}
