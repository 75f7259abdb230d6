package com.scholary.sorter.analyzer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the folder analyzer.
 *
 * <p>{@code provider} picks the implementation; the remaining keys only matter for {@code http}.
 */
@ConfigurationProperties(prefix = "analyzer")
@Validated
public record AnalyzerProperties(
    @NotNull Provider provider,
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero long retryBackoffMillis) {

  public enum Provider {
    HTTP,
    HEURISTIC
  }
}
