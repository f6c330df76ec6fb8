package com.automate.ScanOps.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ScopeRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 2000) String description,
        List<String> allowedHosts,
        List<String> allowedCidrs
) {}
