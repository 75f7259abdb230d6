package com.scholary.sorter.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobType;

/** Diagnostic one-liner for a job; {@code error} is only present for failed jobs. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
    long id, JobStatus status, String folderPath, JobType jobType, String error) {

  public static JobSummary of(Job job) {
    return new JobSummary(job.id(), job.status(), job.folderPath(), job.jobType(), job.error());
  }
}
