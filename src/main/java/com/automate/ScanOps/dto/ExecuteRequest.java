package com.automate.ScanOps.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body of POST /execute on the execution backend. */
public record ExecuteRequest(
        String tool,
        List<String> command,
        int timeout,
        @JsonProperty("memory_limit") int memoryLimit,
        @JsonProperty("cpu_limit") double cpuLimit
) {}
