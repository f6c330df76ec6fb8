package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class ToolAlreadyExistsException extends ApiException {
    public ToolAlreadyExistsException(String slug) {
        super(HttpStatus.CONFLICT, "TOOL_EXISTS", "Tool already registered: " + slug);
    }
}
