package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Another smart scan holds the running slot. Not queued; the caller may retry later.
 */
public class ScanAdmissionConflictException extends ApiException {

    private final UUID runningScanId;

    public ScanAdmissionConflictException(UUID requested, UUID runningScanId) {
        super(HttpStatus.CONFLICT, "SCAN_ALREADY_RUNNING",
                "Cannot start scan " + requested + " right now: another scan is running");
        this.runningScanId = runningScanId;
    }

    public UUID getRunningScanId() {
        return runningScanId;
    }
}
