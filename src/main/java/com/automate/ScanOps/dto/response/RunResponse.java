package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.RunStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RunResponse(
        UUID runId,
        UUID userId,
        String tool,
        int manifestVersion,
        UUID scopeId,
        String target,
        Map<String, Object> params,
        List<String> argv,
        int timeoutSeconds,
        RunStatus status,
        Integer exitCode,
        String stdout,
        String stderr,
        Long durationSeconds,
        String errorMessage,
        UUID smartScanId,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {}
