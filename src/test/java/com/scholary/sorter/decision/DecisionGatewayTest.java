package com.scholary.sorter.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobType;
import com.scholary.sorter.job.JobUpdate;
import com.scholary.sorter.job.Proposal;
import com.scholary.sorter.job.TestStores;
import java.nio.file.Path;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DecisionGatewayTest {

  private static final String FOLDER = "/music/incoming/A";

  @TempDir Path tempDir;

  private JobStore store;
  private DecisionGateway gateway;

  @BeforeEach
  void setUp() {
    store = TestStores.store(tempDir, Clock.systemUTC());
    gateway = new DecisionGateway(store);
  }

  @Test
  void decide_shouldMergeTheOverrideIntoTheProposalOnAccept() {
    Job job = ready(new Proposal("X", "Y", "2001", "album", "high", "from tags"));

    Job accepted =
        gateway.decide(FOLDER, Verdict.ACCEPT, new Proposal("X2", null, null, null, null, null), null);

    assertThat(accepted.id()).isEqualTo(job.id());
    assertThat(accepted.status()).isEqualTo(JobStatus.ACCEPTED);
    assertThat(accepted.proposal())
        .isEqualTo(new Proposal("X2", "Y", "2001", "album", "high", "from tags"));
  }

  @Test
  void accept_shouldKeepTheProposalWithoutOverride() {
    Proposal proposal = new Proposal("X", "Y", null, null, null, null);
    ready(proposal);

    assertThat(gateway.accept(FOLDER, null).proposal()).isEqualTo(proposal);
  }

  @Test
  void skip_shouldConflictTheSecondTime() {
    ready(new Proposal("X", "Y", null, null, null, null));

    assertThat(gateway.skip(FOLDER).status()).isEqualTo(JobStatus.SKIPPED);
    assertThatThrownBy(() -> gateway.skip(FOLDER))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("status is skipped")
        .extracting(e -> ((ConflictException) e).getCurrentStatus())
        .isEqualTo(JobStatus.SKIPPED);
  }

  @Test
  void decide_shouldRequeueAnErrorWithFeedbackOnReconsider() {
    Job job = store.create(FOLDER, JobType.SCAN_DISCOVERED, null).orElseThrow();
    store.transition(job.id(), JobStatus.QUEUED, JobStatus.ANALYZING, JobUpdate.none());
    store.transition(
        job.id(), JobStatus.ANALYZING, JobStatus.ERROR, JobUpdate.none().withError("boom"));

    Job requeued = gateway.decide(FOLDER, Verdict.RECONSIDER, null, "  it's a live album  ");

    assertThat(requeued.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(requeued.error()).isNull();
    assertThat(requeued.feedback()).isEqualTo("it's a live album");
  }

  @Test
  void reconsider_shouldDropTheProposalFromReady() {
    ready(new Proposal("X", "Y", null, null, null, null));

    Job requeued = gateway.reconsider(FOLDER, "wrong artist");

    assertThat(requeued.status()).isEqualTo(JobStatus.QUEUED);
    assertThat(requeued.proposal()).isNull();
  }

  @Test
  void reconsider_shouldRequireFeedback() {
    ready(new Proposal("X", "Y", null, null, null, null));

    assertThatThrownBy(() -> gateway.reconsider(FOLDER, "   "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(store.findLatestByFolder(FOLDER).orElseThrow().status()).isEqualTo(JobStatus.READY);
  }

  @Test
  void accept_shouldConflictForAQueuedJob() {
    store.create(FOLDER, JobType.SCAN_DISCOVERED, null).orElseThrow();

    assertThatThrownBy(() -> gateway.accept(FOLDER, null))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("status is queued");
  }

  @Test
  void skip_shouldReportAnUnknownFolderAsNotFound() {
    assertThatThrownBy(() -> gateway.skip("/nowhere")).isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void skip_shouldRejectABlankPath() {
    assertThatThrownBy(() -> gateway.skip(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromWire_shouldParseVerdictWireNames() {
    assertThat(Verdict.fromWire("reconsider")).isEqualTo(Verdict.RECONSIDER);
    assertThatThrownBy(() -> Verdict.fromWire("maybe"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown action");
  }

  @Test
  void accept_shouldRefuseAProposalReplacedWhileTheVerdictWasApplied() {
    ready(new Proposal("Old", "Y", "2001", null, null, null));
    Proposal replacement = new Proposal("New", "Y", "2001", null, null, null);
    JobStore racing = spy(store);
    doAnswer(
            invocation -> {
              Job seen = invocation.getArgument(0);
              reanalyze(seen.id(), replacement);
              return invocation.callRealMethod();
            })
        .when(racing)
        .transitionIfUnchanged(any(), eq(JobStatus.ACCEPTED), any());

    assertThatThrownBy(() -> new DecisionGateway(racing).accept(FOLDER, null))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("changed while the verdict was applied");

    Job current = store.findLatestByFolder(FOLDER).orElseThrow();
    assertThat(current.status()).isEqualTo(JobStatus.READY);
    assertThat(current.proposal()).isEqualTo(replacement);
  }

  private void reanalyze(long id, Proposal proposal) {
    store.transition(
        id, JobStatus.READY, JobStatus.QUEUED, JobUpdate.none().withFeedback("check the artist"));
    Job claim = store.claimNext(JobStatus.QUEUED, JobStatus.ANALYZING).orElseThrow();
    store.completeClaim(claim, JobStatus.READY, JobUpdate.none().withProposal(proposal));
  }

  private Job ready(Proposal proposal) {
    Job job = store.create(FOLDER, JobType.SCAN_DISCOVERED, null).orElseThrow();
    store.transition(job.id(), JobStatus.QUEUED, JobStatus.ANALYZING, JobUpdate.none());
    store.transition(
        job.id(), JobStatus.ANALYZING, JobStatus.READY, JobUpdate.none().withProposal(proposal));
    return job;
  }
}
