package com.scholary.sorter.job;

import java.time.Instant;

/**
 * Immutable snapshot of one job as read from the {@link JobStore}.
 *
 * <p>Workers only ever hold the snapshot returned by their own claim; the store stays the single
 * source of truth. {@code claimToken} identifies that claim and is {@code null} outside {@code
 * analyzing} and {@code moving}.
 */
public record Job(
    long id,
    String folderPath,
    JobType jobType,
    JobStatus status,
    FolderMetadata metadata,
    Proposal proposal,
    String error,
    String feedback,
    String artistHint,
    String claimToken,
    long revision,
    Instant createdAt,
    Instant updatedAt) {

  public String folderName() {
    if (metadata != null && metadata.folderName() != null) {
      return metadata.folderName();
    }
    int slash = Math.max(folderPath.lastIndexOf('/'), folderPath.lastIndexOf('\\'));
    return slash >= 0 ? folderPath.substring(slash + 1) : folderPath;
  }
}
