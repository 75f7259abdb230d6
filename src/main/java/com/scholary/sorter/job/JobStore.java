package com.scholary.sorter.job;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record store for jobs; the only channel through which pipeline components communicate.
 *
 * <p>All status changes go through a compare-and-set on {@code (id, expectedStatus)}. A write that
 * observes a stale status changes nothing and reports {@code false} / empty, so independently
 * polling workers can race for the same job and exactly one of them wins.
 */
public interface JobStore {

  /**
   * Create a {@link JobStatus#QUEUED} job for a folder that has never been tracked.
   *
   * <p>Folders with any existing job, terminal or not, are left alone.
   *
   * @param artistHint artist inferred from an enclosing collection folder, or {@code null}
   * @return the new job, or empty when the folder is already tracked
   */
  Optional<Job> create(
      String folderPath, JobType jobType, FolderMetadata metadata, String artistHint);

  default Optional<Job> create(String folderPath, JobType jobType, FolderMetadata metadata) {
    return create(folderPath, jobType, metadata, null);
  }

  /**
   * Claim the oldest job in {@code from} by moving it to {@code to}.
   *
   * <p>Candidates that another worker claims first are skipped silently. The returned job carries a
   * fresh {@link Job#claimToken()}; every later write for this claim goes through {@link
   * #completeClaim} or {@link #updateMetadata}, which match on that token.
   *
   * @return the claimed job as it is after the transition, or empty when nothing was claimable
   */
  Optional<Job> claimNext(JobStatus from, JobStatus to);

  /**
   * Record the outcome of a claim.
   *
   * <p>Succeeds only while the job is still held under {@code claim}'s token. Once the watchdog has
   * reverted the job, or another worker has claimed it again, the write is refused.
   *
   * @return true if the outcome was stored
   */
  boolean completeClaim(Job claim, JobStatus next, JobUpdate update);

  /**
   * Atomically move a job from {@code expected} to {@code next}, applying {@code update}.
   *
   * @return true if this call performed the transition, false if the job was not in {@code
   *     expected}
   * @throws IllegalStateException if {@code expected -> next} is not a pipeline edge
   */
  boolean transition(long id, JobStatus expected, JobStatus next, JobUpdate update);

  /**
   * Move a job the caller has read, provided nothing was written to it since.
   *
   * <p>Matches on {@link Job#revision()} as well as the status, so a verdict based on a proposal
   * that has since been replaced is refused.
   */
  boolean transitionIfUnchanged(Job seen, JobStatus next, JobUpdate update);

  /** Replace the metadata snapshot while the job is still held under {@code claim}'s token. */
  boolean updateMetadata(Job claim, FolderMetadata metadata);

  Optional<Job> findById(long id);

  /** Most recent job recorded for a folder, whatever its status. */
  Optional<Job> findLatestByFolder(String folderPath);

  /** Jobs in the given status, most recently updated first. */
  List<Job> listByStatus(JobStatus status, int limit);

  /** Most recently updated jobs, optionally restricted to one status. */
  List<Job> recent(int limit, JobStatus status);

  /** Number of jobs per status; every status is present, zero-filled. */
  Map<JobStatus, Long> countByStatus();

  /** Store-wide change marker; grows with every write. */
  long currentRevision();

  /**
   * Revert jobs stuck in {@code stuck} for longer than {@code olderThan} back to {@code back}.
   *
   * @return number of jobs reverted
   * @throws IllegalStateException if {@code stuck -> back} is not a recovery edge
   */
  int revertStale(JobStatus stuck, JobStatus back, Duration olderThan);
}
