package com.scholary.sorter.job;

/**
 * Published on the application event bus after every successful store write.
 *
 * @param from previous status, {@code null} for a freshly created job
 */
public record JobTransitionEvent(long jobId, String folderPath, JobStatus from, JobStatus to) {}
