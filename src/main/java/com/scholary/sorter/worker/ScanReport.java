package com.scholary.sorter.worker;

/**
 * Outcome of one scan cycle.
 *
 * @param sourceDir root that was scanned, {@code null} when none is configured
 * @param discovered folders that got a new job
 * @param alreadyTracked folders skipped because a job exists for them
 * @param ignored folders skipped because they hold no audio files
 * @param failed folders that could not be inspected or recorded
 * @param error why the whole cycle was skipped, {@code null} on success
 */
public record ScanReport(
    String sourceDir, int discovered, int alreadyTracked, int ignored, int failed, String error) {

  static ScanReport skipped(String sourceDir, String error) {
    return new ScanReport(sourceDir, 0, 0, 0, 0, error);
  }

  public boolean ok() {
    return error == null;
  }
}
