package com.scholary.sorter.status;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for status snapshots and the live event stream.
 *
 * <p>These map to the "events.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "events")
@Validated
public record EventsProperties(
    boolean enabled,
    @Positive int recentWindow,
    @Positive long heartbeatSeconds,
    @Positive long pollMillis,
    @PositiveOrZero long coalesceMillis,
    @PositiveOrZero long cacheTtlMillis,
    @PositiveOrZero long emitterTimeoutMillis) {}
