package com.scholary.sorter.api;

import com.scholary.sorter.decision.DecisionGateway;
import com.scholary.sorter.decision.JobNotFoundException;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.status.JobSummary;
import com.scholary.sorter.status.StatusAggregator;
import com.scholary.sorter.status.StatusSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the review pipeline.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Status counts and the folders waiting for a verdict
 *   <li>Folder detail for review
 *   <li>Verdicts (accept, reconsider, skip)
 *   <li>Job diagnostics
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Pipeline", description = "Review queue, verdicts and diagnostics")
public class PipelineController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

  static final int MAX_LIMIT = 1000;

  private final JobStore jobStore;
  private final StatusAggregator statusAggregator;
  private final DecisionGateway decisionGateway;

  public PipelineController(
      JobStore jobStore, StatusAggregator statusAggregator, DecisionGateway decisionGateway) {
    this.jobStore = jobStore;
    this.statusAggregator = statusAggregator;
    this.decisionGateway = decisionGateway;
  }

  @GetMapping("/status")
  @Operation(summary = "Counts per status plus the ready list")
  public StatusResponse status(@RequestParam(defaultValue = "100") int limit) {
    StatusSnapshot snapshot = statusAggregator.snapshot();
    return new StatusResponse(
        snapshot.counts(), snapshot.processed(), snapshot.total(), readyFolders(limit));
  }

  @GetMapping("/ready")
  @Operation(summary = "Folders waiting for a verdict")
  public List<FolderRef> ready(@RequestParam(defaultValue = "100") int limit) {
    return readyFolders(limit);
  }

  @GetMapping("/folder")
  @Operation(summary = "Job detail for one folder", description = "Latest job recorded for the path")
  public FolderDetailResponse folder(@RequestParam String path) {
    return jobStore
        .findLatestByFolder(path)
        .map(FolderDetailResponse::of)
        .orElseThrow(() -> new JobNotFoundException(path));
  }

  @PostMapping("/decision")
  @Operation(
      summary = "Apply a verdict",
      description =
          "accept (optional proposal override), reconsider (feedback required) or skip. "
              + "Answers 409 when the job is no longer in an eligible status.")
  public Map<String, Object> decide(@Valid @RequestBody DecisionRequest request) {
    LOGGER.info("Decision request: path={}, action={}", request.path(), request.action());
    decisionGateway.decide(request.path(), request.action(), request.proposal(), request.feedback());
    return Map.of();
  }

  @GetMapping("/debug/jobs")
  @Operation(summary = "Counts plus recent jobs, optionally filtered by status")
  public DebugJobsResponse debugJobs(
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(required = false) String status) {
    JobStatus filter = status == null || status.isBlank() ? null : JobStatus.fromWire(status);
    List<JobSummary> recent =
        jobStore.recent(clamp(limit), filter).stream().map(JobSummary::of).toList();
    return new DebugJobsResponse(statusAggregator.snapshot().counts(), recent);
  }

  private List<FolderRef> readyFolders(int limit) {
    return jobStore.listByStatus(JobStatus.READY, clamp(limit)).stream()
        .map(job -> FolderRef.of(job.folderPath()))
        .toList();
  }

  private static int clamp(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return Math.min(limit, MAX_LIMIT);
  }
}
