package com.scholary.sorter.worker;

import com.scholary.sorter.filesystem.DestinationPlanner;
import com.scholary.sorter.filesystem.FolderRelocator;
import com.scholary.sorter.filesystem.RelocationException;
import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobUpdate;
import com.scholary.sorter.logging.StructuredLogger;
import com.scholary.sorter.paths.PathStagingManager;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Claims accepted jobs and relocates their folders into the target tree.
 *
 * <p>The destination is computed from the job's final proposal against the target root that is
 * current when the job is claimed.
 */
@Component
public class MoveWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(MoveWorker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String STAGE = "move";

  private final JobStore jobStore;
  private final FolderRelocator relocator;
  private final PathStagingManager paths;
  private final Duration timeout;

  public MoveWorker(
      JobStore jobStore,
      FolderRelocator relocator,
      PathStagingManager paths,
      WorkerProperties properties) {
    this.jobStore = jobStore;
    this.relocator = relocator;
    this.paths = paths;
    this.timeout = Duration.ofSeconds(properties.move().timeoutSeconds());
  }

  /**
   * Claim and process at most one job.
   *
   * @return true if a job was claimed, whatever its outcome
   */
  public boolean runOnce() {
    Optional<Job> claimed = jobStore.claimNext(JobStatus.ACCEPTED, JobStatus.MOVING);
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
    String targetDir = paths.refresh().current().targetDir();
    if (targetDir == null) {
      fail(job, "ConfigurationException", "No target directory configured");
      return;
    }

    Path source = Paths.get(job.folderPath());
    Path destination = DestinationPlanner.destinationFor(Paths.get(targetDir), job.proposal());
    try {
      relocator.relocate(source, destination, timeout);
    } catch (RelocationException e) {
      fail(job, "RelocationException", e.getMessage());
      return;
    } catch (RuntimeException e) {
      fail(job, e.getClass().getSimpleName(), "Move failed: " + e.getMessage());
      return;
    }

    if (jobStore.completeClaim(job, JobStatus.COMPLETED, JobUpdate.none())) {
      LOGGER.info("Folder moved: {} -> {}", source, destination);
    } else {
      // the folder is already at its destination; only the record is out of step
      LOGGER.error(
          "Job {} is no longer held by this claim but its folder was relocated to {}",
          job.id(),
          destination);
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
