package com.automate.ScanOps.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

// target is checked by the target validator so its reasons reach the caller verbatim
public record CreateRunRequest(
        @NotBlank String tool,
        @NotNull UUID scopeId,
        String target,
        Map<String, Object> params
) {}
