package com.automate.ScanOps.Config;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties("executor")
public class ExecutorProperties {

    /** sandboxed execution backend, POST {baseUrl}/execute */
    @NotBlank
    private String baseUrl;

    @Min(100) @Max(60000)
    private int connectTimeoutMs = 5000;

    @Positive
    private int defaultTimeoutSeconds = 300;

    @Positive
    private int defaultMemoryLimit = 512;

    @Positive
    private double defaultCpuLimit = 1.0;

    /** worker threads for standalone runs */
    @Min(1) @Max(64)
    private int concurrency = 5;

    @Min(1)
    private int queueCapacity = 100;

    /** cap on stdout/stderr kept per run, in characters */
    @Positive
    private int maxOutputChars = 1_000_000;
}
