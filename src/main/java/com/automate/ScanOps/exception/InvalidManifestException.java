package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class InvalidManifestException extends ApiException {
    public InvalidManifestException(String reason) {
        super(HttpStatus.BAD_REQUEST, "INVALID_MANIFEST", reason);
    }
}
