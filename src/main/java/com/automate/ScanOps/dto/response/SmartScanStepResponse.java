package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStepStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record SmartScanStepResponse(
        int stepNumber,
        SmartScanPhase phase,
        String name,
        String description,
        String tool,
        boolean critical,
        SmartScanStepStatus status,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        Long durationSeconds,
        String errorMessage,
        UUID runId
) {}
