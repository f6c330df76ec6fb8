package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

// cancel on a session that already finished on its own
public class ScanCancelConflictException extends ApiException {
    public ScanCancelConflictException(UUID id, String status) {
        super(HttpStatus.CONFLICT, InvalidStateTransitionException.CODE,
                "Cannot cancel scan " + id + " because status = " + status);
    }
}
