package com.automate.ScanOps.Models;

public enum SmartScanStepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
