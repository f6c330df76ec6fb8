package com.automate.ScanOps.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record ScopeResponse(
        UUID scopeId,
        String name,
        String description,
        List<String> allowedHosts,
        List<String> allowedCidrs,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
