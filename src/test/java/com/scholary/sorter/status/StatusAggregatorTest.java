package com.scholary.sorter.status;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobTransitionEvent;
import com.scholary.sorter.job.JobType;
import com.scholary.sorter.job.JobUpdate;
import com.scholary.sorter.job.TestStores;
import java.nio.file.Path;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatusAggregatorTest {

  @TempDir Path tempDir;

  private JobStore store;
  private StatusAggregator aggregator;

  @BeforeEach
  void setUp() {
    store = TestStores.store(tempDir, Clock.systemUTC());
    aggregator = new StatusAggregator(store, new EventsProperties(true, 2, 30, 1000, 0, 60_000, 0));
  }

  @Test
  void snapshot_shouldReportEveryStatusAtZeroForAnEmptyStore() {
    StatusSnapshot snapshot = aggregator.snapshot();

    assertThat(snapshot.counts()).hasSize(JobStatus.values().length).containsValue(0L);
    assertThat(snapshot.counts().keySet())
        .containsExactly(
            "queued", "analyzing", "ready", "accepted", "moving", "skipped", "completed", "error");
    assertThat(snapshot.total()).isZero();
    assertThat(snapshot.recent()).isEmpty();
  }

  @Test
  void compute_shouldPartitionTheStoreAndBoundRecent() {
    Job a = store.create("/music/A", JobType.SCAN_DISCOVERED, null).orElseThrow();
    Job b = store.create("/music/B", JobType.SCAN_DISCOVERED, null).orElseThrow();
    store.create("/music/C", JobType.SCAN_DISCOVERED, null).orElseThrow();
    store.transition(a.id(), JobStatus.QUEUED, JobStatus.ANALYZING, JobUpdate.none());
    store.transition(a.id(), JobStatus.ANALYZING, JobStatus.READY, JobUpdate.none());
    store.transition(a.id(), JobStatus.READY, JobStatus.SKIPPED, JobUpdate.none());
    store.transition(b.id(), JobStatus.QUEUED, JobStatus.ANALYZING, JobUpdate.none());
    store.transition(
        b.id(), JobStatus.ANALYZING, JobStatus.ERROR, JobUpdate.none().withError("boom"));

    StatusSnapshot snapshot = aggregator.compute();

    assertThat(snapshot.counts())
        .containsEntry("queued", 1L)
        .containsEntry("skipped", 1L)
        .containsEntry("error", 1L);
    assertThat(snapshot.total()).isEqualTo(3);
    assertThat(snapshot.total())
        .isEqualTo(snapshot.counts().values().stream().mapToLong(Long::longValue).sum());
    assertThat(snapshot.processed()).isEqualTo(1);
    assertThat(snapshot.recent()).hasSize(2);
    assertThat(snapshot.revision()).isEqualTo(store.currentRevision());
  }

  @Test
  void snapshot_shouldDropTheCachedValueOnTransition() {
    assertThat(aggregator.snapshot().total()).isZero();
    Job job = store.create("/music/A", JobType.SCAN_DISCOVERED, null).orElseThrow();

    assertThat(aggregator.snapshot().total()).isZero();

    aggregator.onTransition(new JobTransitionEvent(job.id(), job.folderPath(), null, JobStatus.QUEUED));
    assertThat(aggregator.snapshot().total()).isEqualTo(1);
  }
}
