package com.scholary.sorter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that a log shipper can index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a status transition written to the store. */
  public void logTransition(long jobId, String folder, String from, String to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("from", String.valueOf(from));
      MDC.put("to", to);

      logger.info("Job transition: jobId={}, folder={}, {} -> {}", jobId, folder, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a lost claim race (expected status was stale). */
  public void logClaimConflict(long jobId, String expected, String next) {
    try {
      MDC.put("event_type", "claim_conflict");
      MDC.put("from", expected);
      MDC.put("to", next);

      logger.debug(
          "Claim lost: jobId={}, expected={}, next={} (another worker won)", jobId, expected, next);
    } finally {
      clearEventFields();
    }
  }

  /** Log a per-job failure captured by a worker. */
  public void logJobFailed(long jobId, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      logger.warn(
          "Job failed: jobId={}, stage={}, error={}, message={}", jobId, stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of one scan cycle. */
  public void logScanCompleted(String sourceDir, int discovered, int alreadyTracked, long durationMs) {
    try {
      MDC.put("event_type", "scan_completed");
      MDC.put("discovered", String.valueOf(discovered));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Scan completed: source={}, discovered={}, alreadyTracked={}, duration={}ms",
          sourceDir,
          discovered,
          alreadyTracked,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stale-job recovery pass that reverted at least one job. */
  public void logStaleReverted(String stuck, String back, int count) {
    try {
      MDC.put("event_type", "stale_reverted");
      MDC.put("from", stuck);
      MDC.put("to", back);

      logger.warn("Reverted {} stale job(s): {} -> {}", count, stuck, back);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(long jobId, String folder, String stage) {
    MDC.put("jobId", String.valueOf(jobId));
    MDC.put("folder", folder);
    MDC.put("stage", stage);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("folder");
    MDC.remove("stage");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("from");
    MDC.remove("to");
    MDC.remove("errorType");
    MDC.remove("discovered");
    MDC.remove("durationMs");
  }
}
