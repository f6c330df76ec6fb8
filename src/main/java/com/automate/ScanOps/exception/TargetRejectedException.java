package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class TargetRejectedException extends ApiException {

    public static final String UNSAFE = "TARGET_UNSAFE";
    public static final String OUT_OF_SCOPE = "TARGET_OUT_OF_SCOPE";

    private TargetRejectedException(String code, String reason) {
        super(HttpStatus.BAD_REQUEST, code, reason);
    }

    public static TargetRejectedException unsafe(String reason) {
        return new TargetRejectedException(UNSAFE, reason);
    }

    public static TargetRejectedException outOfScope(String reason) {
        return new TargetRejectedException(OUT_OF_SCOPE, reason);
    }
}
