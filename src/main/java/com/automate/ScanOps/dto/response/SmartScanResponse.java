package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.ScanObjective;
import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record SmartScanResponse(
        UUID sessionId,
        UUID userId,
        String name,
        String target,
        UUID scopeId,
        ScanObjective objective,
        int maxTools,
        SmartScanStatus status,
        int progress,
        SmartScanPhase currentPhase,
        int totalFindings,
        int criticalFindings,
        int highFindings,
        int riskScore,
        String errorMessage,
        List<SmartScanStepResponse> steps,
        List<FindingResponse> findings,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {}
