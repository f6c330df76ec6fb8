package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

public class ToolNotFoundException extends ApiException {
    public ToolNotFoundException(String slug) {
        super(HttpStatus.NOT_FOUND, "TOOL_NOT_FOUND", "Tool not found: " + slug);
    }
}
