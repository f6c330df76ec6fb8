package com.automate.ScanOps.dto.request;

import jakarta.validation.constraints.NotNull;

public record ToolEnabledRequest(@NotNull Boolean enabled) {}
