package com.automate.ScanOps.Models;

public enum SmartScanPhase {
    INTELLIGENCE_PLANNING,
    AUTOMATED_SCAN,
    DEEP_RECONNAISSANCE,
    VULNERABILITY_SCANNING,
    EXPLOITATION_CHAIN,
    FINAL_REPORT
}
