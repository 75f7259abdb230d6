package com.scholary.sorter.decision;

import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobUpdate;
import com.scholary.sorter.job.Proposal;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies reviewer verdicts to jobs.
 *
 * <p>Verdicts address the latest job of a folder. Each one is a single compare-and-set against the
 * job exactly as it was read (status and revision), so two reviewers deciding at once, or a
 * reviewer racing a worker, produce exactly one winner and a {@link ConflictException} for everyone
 * else. An accept never merges its override into a proposal that has since been replaced.
 */
@Service
public class DecisionGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(DecisionGateway.class);

  private static final Set<JobStatus> RECONSIDERABLE = EnumSet.of(JobStatus.READY, JobStatus.ERROR);

  private final JobStore jobStore;

  public DecisionGateway(JobStore jobStore) {
    this.jobStore = jobStore;
  }

  /**
   * Apply a verdict.
   *
   * @param override only used for {@link Verdict#ACCEPT}
   * @param feedback required for {@link Verdict#RECONSIDER}
   */
  public Job decide(String folderPath, Verdict verdict, Proposal override, String feedback) {
    return switch (verdict) {
      case ACCEPT -> accept(folderPath, override);
      case RECONSIDER -> reconsider(folderPath, feedback);
      case SKIP -> skip(folderPath);
    };
  }

  /** {@code ready -> accepted}; non-null fields of {@code override} replace the proposal's. */
  public Job accept(String folderPath, Proposal override) {
    Job job = latest(folderPath);
    requireStatus(job, Set.of(JobStatus.READY), Verdict.ACCEPT);

    Proposal base = job.proposal() == null ? Proposal.empty() : job.proposal();
    Proposal accepted = base.mergedWith(override);
    apply(job, JobStatus.ACCEPTED, JobUpdate.none().withProposal(accepted), Verdict.ACCEPT);
    return reload(job);
  }

  /** {@code ready|error -> queued} with the feedback attached for the next analysis. */
  public Job reconsider(String folderPath, String feedback) {
    if (feedback == null || feedback.isBlank()) {
      throw new IllegalArgumentException("Feedback is required to reconsider");
    }
    Job job = latest(folderPath);
    requireStatus(job, RECONSIDERABLE, Verdict.RECONSIDER);

    apply(job, JobStatus.QUEUED, JobUpdate.none().withFeedback(feedback.trim()), Verdict.RECONSIDER);
    return reload(job);
  }

  /** {@code ready -> skipped}; the folder is never processed again. */
  public Job skip(String folderPath) {
    Job job = latest(folderPath);
    requireStatus(job, Set.of(JobStatus.READY), Verdict.SKIP);

    apply(job, JobStatus.SKIPPED, JobUpdate.none(), Verdict.SKIP);
    return reload(job);
  }

  private Job latest(String folderPath) {
    if (folderPath == null || folderPath.isBlank()) {
      throw new IllegalArgumentException("Folder path is required");
    }
    return jobStore
        .findLatestByFolder(folderPath)
        .orElseThrow(() -> new JobNotFoundException(folderPath));
  }

  private static void requireStatus(Job job, Set<JobStatus> eligible, Verdict verdict) {
    if (!eligible.contains(job.status())) {
      throw new ConflictException(
          String.format(
              "Cannot %s job %d: status is %s",
              verdict.wireName(), job.id(), job.status().wireName()),
          job.status());
    }
  }

  private void apply(Job job, JobStatus next, JobUpdate update, Verdict verdict) {
    if (!jobStore.transitionIfUnchanged(job, next, update)) {
      JobStatus now = jobStore.findById(job.id()).map(Job::status).orElse(job.status());
      throw new ConflictException(
          String.format(
              "Cannot %s job %d: it changed while the verdict was applied, status is now %s",
              verdict.wireName(), job.id(), now.wireName()),
          now);
    }
    LOGGER.info(
        "Verdict applied: jobId={}, folder={}, verdict={}, {} -> {}",
        job.id(),
        job.folderPath(),
        verdict.wireName(),
        job.status().wireName(),
        next.wireName());
  }

  private Job reload(Job job) {
    return jobStore.findById(job.id()).orElse(job);
  }
}
