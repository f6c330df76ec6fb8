package com.automate.ScanOps.Config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties("smart-scan")
public class SmartScanProperties {

    /** whole-session budget; exceeding it ends the session as TIMEOUT */
    @NotNull
    private Duration wallClockBudget = Duration.ofHours(2);

    /** more failed or timed-out steps than this ends the session as FAILED */
    @Min(0)
    private int maxFailedSteps = 4;

    @Min(1) @Max(50)
    private int defaultMaxTools = 20;
}
