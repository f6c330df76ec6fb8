package com.automate.ScanOps.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteResponse(
        String stdout,
        String stderr,
        @JsonProperty("exit_code") Integer exitCode,
        Double duration
) {}
