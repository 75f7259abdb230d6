package com.scholary.sorter.job;

/**
 * Field changes applied together with a status transition.
 *
 * <p>Fields left unset keep their stored value, with two store-enforced exceptions: {@code error}
 * is cleared whenever the target status is not {@link JobStatus#ERROR}, and {@code proposal} is
 * cleared on entry to {@link JobStatus#QUEUED}.
 */
public final class JobUpdate {

  private static final JobUpdate NONE = new JobUpdate(null, null, null, null, false);

  private final FolderMetadata metadata;
  private final Proposal proposal;
  private final String error;
  private final String feedback;
  private final boolean clearFeedback;

  private JobUpdate(
      FolderMetadata metadata,
      Proposal proposal,
      String error,
      String feedback,
      boolean clearFeedback) {
    this.metadata = metadata;
    this.proposal = proposal;
    this.error = error;
    this.feedback = feedback;
    this.clearFeedback = clearFeedback;
  }

  public static JobUpdate none() {
    return NONE;
  }

  public JobUpdate withMetadata(FolderMetadata value) {
    return new JobUpdate(value, proposal, error, feedback, clearFeedback);
  }

  public JobUpdate withProposal(Proposal value) {
    return new JobUpdate(metadata, value, error, feedback, clearFeedback);
  }

  public JobUpdate withError(String value) {
    return new JobUpdate(metadata, proposal, value, feedback, clearFeedback);
  }

  public JobUpdate withFeedback(String value) {
    return new JobUpdate(metadata, proposal, error, value, false);
  }

  public JobUpdate clearingFeedback() {
    return new JobUpdate(metadata, proposal, error, null, true);
  }

  public FolderMetadata metadata() {
    return metadata;
  }

  public Proposal proposal() {
    return proposal;
  }

  public String error() {
    return error;
  }

  public String feedback() {
    return feedback;
  }

  public boolean clearFeedback() {
    return clearFeedback;
  }
}
