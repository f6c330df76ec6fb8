package com.automate.ScanOps.Models;

/**
 * Outcome of a validator: either ok, or rejected with a reason fit for display.
 */
public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean rejected() {
        return !valid;
    }
}
