package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.Severity;

import java.time.LocalDateTime;
import java.util.UUID;

public record FindingResponse(
        UUID findingId,
        String title,
        Severity severity,
        String category,
        String tool,
        String description,
        UUID runId,
        LocalDateTime createdAt
) {}
