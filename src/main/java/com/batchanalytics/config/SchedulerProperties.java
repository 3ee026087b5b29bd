package com.batchanalytics.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Scheduler and worker pool settings ({@code app.scheduler.*}).
 *
 * Defaults match the batch processor's historical configuration.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.scheduler")
public class SchedulerProperties {

    @NotNull
    private Mode mode = Mode.CONTINUOUS;

    @NotNull
    private Duration checkInterval = Duration.ofSeconds(60);

    @Min(1)
    private int maxConcurrentJobs = 10;

    @NotNull
    private Duration jobTimeout = Duration.ofSeconds(3600);

    /** Total attempts per job, the first one included. */
    @Min(1)
    private int maxRetries = 3;

    @NotNull
    private Duration retryDelay = Duration.ofSeconds(60);

    @DecimalMin("1.0")
    private double retryBackoffMultiplier = 1.0;

    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    public enum Mode {
        /** Tick forever on the check interval. */
        CONTINUOUS,
        /** Run a single tick, wait for its jobs, then exit. */
        ONCE,
        /** Do not tick; the API can still trigger ticks. */
        DISABLED
    }
}
