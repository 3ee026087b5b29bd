package com.batchanalytics.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Write-back retry policy for job results ({@code app.store.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {

    @Min(1)
    private int writeAttempts = 3;

    @NotNull
    private Duration writeRetryDelay = Duration.ofMillis(500);
}
