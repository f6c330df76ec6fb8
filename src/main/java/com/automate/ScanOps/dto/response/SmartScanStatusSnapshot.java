package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.SmartScanPhase;
import com.automate.ScanOps.Models.SmartScanStatus;
import com.automate.ScanOps.Models.SmartScanStepStatus;

import java.util.List;
import java.util.UUID;

public record SmartScanStatusSnapshot(
        UUID sessionId,
        String target,
        SmartScanStatus status,
        int progress,
        SmartScanPhase currentPhase,
        List<StepState> steps,
        int totalFindings,
        int riskScore,
        String errorMessage
) {

    public record StepState(
            int stepNumber,
            String name,
            SmartScanPhase phase,
            String tool,
            SmartScanStepStatus status,
            Long durationSeconds,
            String errorMessage,
            UUID runId
    ) {}
}
