package com.scholary.sorter.api;

import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.Proposal;

/**
 * Everything a reviewer needs to decide on a folder.
 *
 * <p>{@code proposal} is {@code null} until analysis succeeded.
 */
public record FolderDetailResponse(
    long jobId,
    String path,
    JobStatus status,
    FolderMetadata metadata,
    Proposal proposal,
    String error,
    String feedback) {

  public static FolderDetailResponse of(Job job) {
    return new FolderDetailResponse(
        job.id(),
        job.folderPath(),
        job.status(),
        job.metadata(),
        job.proposal(),
        job.error(),
        job.feedback());
  }
}
