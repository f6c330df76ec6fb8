package com.automate.ScanOps.dto.response;

import java.time.LocalDateTime;
import java.util.UUID;

public record ToolResponse(
        UUID toolId,
        String slug,
        String name,
        String category,
        String description,
        boolean enabled,
        ManifestResponse activeManifest,
        LocalDateTime createdAt
) {}
