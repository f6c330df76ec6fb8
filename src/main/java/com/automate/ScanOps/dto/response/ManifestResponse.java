package com.automate.ScanOps.dto.response;

import com.automate.ScanOps.Models.ParameterSchema;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ManifestResponse(
        UUID manifestId,
        int version,
        String binary,
        Map<String, ParameterSchema> argsSchema,
        List<String> commandTemplate,
        int timeout,
        int memoryLimit,
        double cpuLimit,
        boolean active,
        LocalDateTime createdAt
) {}
