package com.automate.ScanOps.exception;

import org.springframework.http.HttpStatus;

// tool exists but cannot be launched right now
public class ToolUnavailableException extends ApiException {

    private ToolUnavailableException(String code, String reason) {
        super(HttpStatus.CONFLICT, code, reason);
    }

    public static ToolUnavailableException disabled(String slug) {
        return new ToolUnavailableException("TOOL_DISABLED", "Tool " + slug + " is disabled");
    }

    public static ToolUnavailableException noActiveManifest(String slug) {
        return new ToolUnavailableException("NO_ACTIVE_MANIFEST", "Tool " + slug + " has no active manifest");
    }
}
