package com.scholary.sorter.job;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job store.
 *
 * <p>These map to the "jobstore.*" keys in application.yml. The datasource URL is derived from
 * {@code dbPath} there as well.
 */
@ConfigurationProperties(prefix = "jobstore")
@Validated
public record JobStoreProperties(@NotBlank String dbPath, @Positive int claimBatchSize) {}
