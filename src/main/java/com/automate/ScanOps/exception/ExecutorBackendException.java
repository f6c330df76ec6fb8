package com.automate.ScanOps.exception;

/**
 * Non-2xx answer from the execution backend. Classified into a FAILED run, never shown raw.
 */
public class ExecutorBackendException extends RuntimeException {
    private static final int BODY_PREVIEW_MAX = 500;

    private final int statusCode;
    private final String responseBody;

    public ExecutorBackendException(int statusCode, String message, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public static ExecutorBackendException of(int statusCode, String path, String body) {
        return new ExecutorBackendException(statusCode, "Execution backend returned " + statusCode + " on " + path, body);
    }

    public int getStatusCode() { return statusCode; }
    public String getResponseBody() { return responseBody; }

    public boolean isServerError() { return statusCode >= 500; }

    public String bodyPreview() {
        if (responseBody == null) return null;
        return responseBody.length() <= BODY_PREVIEW_MAX
                ? responseBody
                : responseBody.substring(0, BODY_PREVIEW_MAX) + "...(truncated)";
    }

    @Override
    public String toString() {
        return "ExecutorBackendException{statusCode=" + statusCode +
                ", message=" + getMessage() +
                ", bodyPreview=" + bodyPreview() +
                '}';
    }
}
