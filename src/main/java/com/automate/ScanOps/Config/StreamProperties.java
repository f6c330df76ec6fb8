package com.automate.ScanOps.Config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties("stream")
public class StreamProperties {

    @Min(1)
    private int replayBufferSize = 100;

    /** how long a finished channel keeps its replay buffer */
    @NotNull
    private Duration cleanupDelay = Duration.ofSeconds(60);

    /** polling fallback interval of the status client */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    /** 0 means no emitter timeout */
    @Min(0)
    private long emitterTimeoutMs = 0L;
}
