package com.automate.ScanOps.Models;

/**
 * Classified terminal outcome of one execution. Execution problems are carried here, never thrown.
 */
public record RunResult(
        RunStatus status,
        Integer exitCode,
        String stdout,
        String stderr,
        long durationSeconds
) {
}
