package com.scholary.sorter.worker;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for stale-job recovery.
 *
 * <p>The thresholds must stay above the analyze and move timeouts, otherwise a live worker could
 * lose its job.
 */
@ConfigurationProperties(prefix = "watchdog")
@Validated
public record WatchdogProperties(
    boolean enabled,
    @Positive long intervalSeconds,
    @Positive long staleAnalyzingSeconds,
    @Positive long staleMovingSeconds) {}
