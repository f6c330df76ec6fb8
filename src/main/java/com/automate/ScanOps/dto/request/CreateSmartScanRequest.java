package com.automate.ScanOps.dto.request;

import com.automate.ScanOps.Models.ScanObjective;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record CreateSmartScanRequest(
        @Size(max = 200) String name,
        String target,
        @NotNull UUID scopeId,
        ScanObjective objective,
        @Min(1) @Max(50) Integer maxTools
) {}
