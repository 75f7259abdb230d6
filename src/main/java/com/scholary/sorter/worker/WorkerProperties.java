package com.scholary.sorter.worker;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline stages.
 *
 * <p>Each stage can be switched off per process, so one artifact can run everything or a single
 * stage against a shared store.
 */
@ConfigurationProperties(prefix = "workers")
@Validated
public record WorkerProperties(
    @Valid @NotNull Stage scan, @Valid @NotNull Stage analyze, @Valid @NotNull Stage move) {

  /**
   * @param enabled whether this process runs the stage at all
   * @param pollSeconds sleep between drain passes of one loop
   * @param instances number of independent polling loops
   * @param timeoutSeconds bound on a single unit of work (analyzer call, folder move)
   */
  public record Stage(
      boolean enabled,
      @Positive long pollSeconds,
      @PositiveOrZero int instances,
      @Positive long timeoutSeconds) {}
}
