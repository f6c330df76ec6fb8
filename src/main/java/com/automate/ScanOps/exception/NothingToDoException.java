package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

/**
 * The requested transition already happened; distinct from a transition that is not allowed.
 */
public class NothingToDoException extends ApiException {

    private NothingToDoException(String code, String reason) {
        super(HttpStatus.CONFLICT, code, reason);
    }

    public static NothingToDoException alreadyCancelled(String what, Object id) {
        return new NothingToDoException("ALREADY_CANCELLED", what + " " + id + " is already cancelled");
    }

    public static NothingToDoException alreadyStarted(String what, Object id) {
        return new NothingToDoException("ALREADY_STARTED", what + " " + id + " is already running");
    }

    public static NothingToDoException alreadyFinished(String what, Object id, Object status) {
        return new NothingToDoException("ALREADY_FINISHED", what + " " + id + " already finished with status " + status);
    }
}
