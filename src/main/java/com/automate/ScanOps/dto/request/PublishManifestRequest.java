package com.automate.ScanOps.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;
import java.util.Map;

/**
 * Manifest document as posted by an administrator. {@code argsSchema} is either a plain
 * {@code name -> definition} map or a JSON-schema style object with {@code properties}
 * and a {@code required} list.
 */
public record PublishManifestRequest(
        @NotBlank String binary,
        Map<String, Object> argsSchema,
        @NotEmpty List<String> commandTemplate,
        @Positive Integer timeout,
        @Positive Integer memoryLimit,
        @Positive Double cpuLimit
) {}
