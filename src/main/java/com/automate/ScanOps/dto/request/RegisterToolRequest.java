package com.automate.ScanOps.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterToolRequest(
        @NotBlank @Size(max = 64) @Pattern(regexp = "^[a-z0-9-]+$", message = "must be lower-case letters, digits or dashes") String slug,
        @NotBlank String name,
        String category,
        @Size(max = 2000) String description
) {}
