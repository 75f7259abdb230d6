package com.scholary.sorter.decision;

import com.scholary.sorter.job.JobStatus;

/**
 * The job is not in a status the requested verdict applies to.
 *
 * <p>Callers should re-read the job instead of retrying.
 */
public class ConflictException extends RuntimeException {

  private final JobStatus currentStatus;

  public ConflictException(String message, JobStatus currentStatus) {
    super(message);
    this.currentStatus = currentStatus;
  }

  public JobStatus getCurrentStatus() {
    return currentStatus;
  }
}
