package com.scholary.sorter.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pipeline status of a job.
 *
 * <p>The status is the only authoritative input for transitions. Each constant knows which statuses
 * it may move to; the store refuses any other edge.
 *
 * <pre>
 * queued    -> analyzing            (analyze worker claims)
 * analyzing -> ready | error        (analyzer result)
 * ready     -> accepted | queued | skipped   (human verdict)
 * error     -> queued               (human reconsider)
 * accepted  -> moving               (move worker claims)
 * moving    -> completed | error    (move result)
 * </pre>
 *
 * <p>The watchdog additionally reverts {@code analyzing -> queued} and {@code moving -> accepted}
 * for jobs orphaned by a crashed worker; see {@link #isRecoveryEdge(JobStatus)}.
 */
public enum JobStatus {
  QUEUED,
  ANALYZING,
  READY,
  ACCEPTED,
  MOVING,
  SKIPPED,
  COMPLETED,
  ERROR;

  private static final Set<JobStatus> TERMINAL = EnumSet.of(SKIPPED, COMPLETED);

  /** Lower-case name used on the wire and in the store. */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("status must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown job status: " + value, e);
    }
  }

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  /** Statuses a worker holds a job in between its claim and its outcome. */
  public boolean isClaimed() {
    return this == ANALYZING || this == MOVING;
  }

  /** Statuses that count as "active" for the one-job-per-folder rule. */
  public static List<JobStatus> nonTerminal() {
    return Arrays.stream(values()).filter(s -> !s.isTerminal()).toList();
  }

  /** Whether {@code this -> target} is a regular pipeline edge. */
  public boolean canTransitionTo(JobStatus target) {
    return switch (this) {
      case QUEUED -> target == ANALYZING;
      case ANALYZING -> target == READY || target == ERROR;
      case READY -> target == ACCEPTED || target == QUEUED || target == SKIPPED;
      case ERROR -> target == QUEUED;
      case ACCEPTED -> target == MOVING;
      case MOVING -> target == COMPLETED || target == ERROR;
      case SKIPPED, COMPLETED -> false;
    };
  }

  /** Whether {@code this -> target} is an edge reserved for stale-job recovery. */
  public boolean isRecoveryEdge(JobStatus target) {
    return (this == ANALYZING && target == QUEUED) || (this == MOVING && target == ACCEPTED);
  }
}
