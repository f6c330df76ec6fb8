package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.RunStatus;

import java.util.UUID;

/**
 * What the polling fallback reads once per interval.
 */
public record RunStatusSnapshot(
        UUID runId,
        String target,
        RunStatus status,
        Integer exitCode,
        String stdout,
        String stderr,
        Long durationSeconds,
        String errorMessage
) {}
