package com.scholary.sorter.worker;

import com.scholary.sorter.analyzer.AnalysisRequest;
import com.scholary.sorter.analyzer.AnalyzerException;
import com.scholary.sorter.analyzer.FolderAnalyzer;
import com.scholary.sorter.filesystem.FolderInspector;
import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobUpdate;
import com.scholary.sorter.job.Proposal;
import com.scholary.sorter.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Claims queued jobs and turns them into proposals.
 *
 * <p>Flow per job:
 *
 * <ol>
 *   <li>claim {@code queued -> analyzing}
 *   <li>re-snapshot the folder and store the metadata
 *   <li>call the analyzer with the snapshot and any reviewer feedback, bounded by a timeout
 *   <li>{@code analyzing -> ready} with the proposal, or {@code analyzing -> error} with the reason
 * </ol>
 *
 * <p>No job is retried automatically; an errored job waits for a reviewer to reconsider it.
 */
@Component
public class AnalyzeWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeWorker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String STAGE = "analyze";

  private final JobStore jobStore;
  private final FolderInspector inspector;
  private final FolderAnalyzer analyzer;
  private final ThreadPoolTaskExecutor analysisExecutor;
  private final long timeoutSeconds;

  public AnalyzeWorker(
      JobStore jobStore,
      FolderInspector inspector,
      FolderAnalyzer analyzer,
      @Qualifier("analysisExecutor") ThreadPoolTaskExecutor analysisExecutor,
      WorkerProperties properties) {
    this.jobStore = jobStore;
    this.inspector = inspector;
    this.analyzer = analyzer;
    this.analysisExecutor = analysisExecutor;
    this.timeoutSeconds = properties.analyze().timeoutSeconds();
  }

  /**
   * Claim and process at most one job.
   *
   * @return true if a job was claimed, whatever its outcome
   */
  public boolean runOnce() {
    Optional<Job> claimed = jobStore.claimNext(JobStatus.QUEUED, JobStatus.ANALYZING);
    if (claimed.isEmpty()) {
      return false;
    }

    Job job = claimed.get();
    try {
      StructuredLogger.setJobContext(job.id(), job.folderPath(), STAGE);
      process(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
    return true;
  }

  private void process(Job job) {
    Path folder = Paths.get(job.folderPath());
    FolderMetadata metadata;
    try {
      metadata = inspector.snapshot(folder);
    } catch (NoSuchFileException e) {
      fail(job, "NotFound", "Folder no longer exists: " + job.folderPath());
      return;
    } catch (IOException e) {
      fail(job, e.getClass().getSimpleName(), "Cannot read folder: " + e.getMessage());
      return;
    }

    if (!jobStore.updateMetadata(job, metadata)) {
      LOGGER.warn("Job {} is no longer held by this claim; dropping it", job.id());
      return;
    }

    Proposal proposal;
    try {
      proposal =
          callAnalyzer(
              job.id(),
              new AnalysisRequest(job.folderPath(), metadata, job.feedback(), job.artistHint()));
    } catch (AnalyzerException e) {
      fail(job, "AnalyzerException", e.getMessage());
      return;
    } catch (RuntimeException e) {
      fail(job, e.getClass().getSimpleName(), "Analyzer failed: " + e.getMessage());
      return;
    }

    if (proposal == null || proposal.isBlank()) {
      fail(job, "AnalyzerException", "Analyzer returned an empty proposal");
      return;
    }

    boolean stored =
        jobStore.completeClaim(
            job, JobStatus.READY, JobUpdate.none().withProposal(proposal).clearingFeedback());
    if (stored) {
      LOGGER.info(
          "Proposal ready: artist={}, album={}, year={}",
          proposal.artist(),
          proposal.album(),
          proposal.year());
    } else {
      LOGGER.warn("Job {} is no longer held by this claim; proposal dropped", job.id());
    }
  }

  private Proposal callAnalyzer(long jobId, AnalysisRequest request) {
    Future<Proposal> future;
    try {
      future =
          analysisExecutor
              .getThreadPoolExecutor()
              .submit(
                  () -> {
                    try {
                      StructuredLogger.setJobContext(jobId, request.folderPath(), STAGE);
                      return analyzer.analyze(request);
                    } finally {
                      StructuredLogger.clearJobContext();
                    }
                  });
    } catch (RejectedExecutionException e) {
      throw new AnalyzerException("Analyzer pool is saturated", e);
    }

    try {
      return future.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new AnalyzerException("Analyzer timed out after " + timeoutSeconds + "s", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AnalyzerException analyzerException) {
        throw analyzerException;
      }
      throw new AnalyzerException(String.valueOf(cause.getMessage()), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new AnalyzerException("Interrupted while waiting for the analyzer", e);
    }
  }

  private void fail(Job job, String errorType, String message) {
    structuredLogger.logJobFailed(job.id(), STAGE, errorType, message);
    boolean stored =
        jobStore.completeClaim(job, JobStatus.ERROR, JobUpdate.none().withError(message));
    if (!stored) {
      LOGGER.warn("Job {} is no longer held by this claim; failure not recorded", job.id());
    }
  }
}
