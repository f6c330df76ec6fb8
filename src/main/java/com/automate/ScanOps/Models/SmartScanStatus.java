package com.automate.ScanOps.Models;

public enum SmartScanStatus {
    CREATED,
    RUNNING,
    /** Reserved; no transition enters it yet. */
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }
}
