package com.scholary.sorter.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.sorter.logging.StructuredLogger;
import java.nio.file.Paths;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * SQLite-backed {@link JobStore}.
 *
 * <p>Every status change is a single conditional {@code UPDATE ... WHERE id = ? AND status = ?}.
 * SQLite serializes writers, so the affected-row count tells the caller whether it won the race.
 * No lock is held across the analyzer call or the file move; those run after the claim commits.
 *
 * <p>Each write also bumps {@code revision} to one past the current maximum, which gives observers
 * in other processes a cheap change marker and gives every written row state a distinct value.
 *
 * <p>Entering {@code analyzing} or {@code moving} stamps a random {@code claim_token}. Worker
 * outcomes match on it, so a worker whose claim was reverted by the watchdog cannot overwrite the
 * job once another worker holds it.
 */
@Repository
@DependsOn("jobSchema")
public class JdbcJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcJobStore.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String NEXT_REVISION = "(SELECT COALESCE(MAX(revision), 0) + 1 FROM jobs)";
  private static final String COLUMNS =
      "id, folder_path, job_type, status, metadata_json, proposal_json, error, feedback,"
          + " artist_hint, claim_token, revision, created_at_ms, updated_at_ms";

  private final JdbcTemplate jdbc;
  private final ObjectMapper objectMapper;
  private final ApplicationEventPublisher events;
  private final Clock clock;
  private final int claimBatchSize;
  private final RowMapper<Job> rowMapper = this::mapRow;

  public JdbcJobStore(
      JdbcTemplate jdbc,
      ObjectMapper objectMapper,
      ApplicationEventPublisher events,
      Clock clock,
      JobStoreProperties properties) {
    this.jdbc = jdbc;
    this.objectMapper = objectMapper;
    this.events = events;
    this.clock = clock;
    this.claimBatchSize = properties.claimBatchSize();
  }

  @Override
  public Optional<Job> create(
      String folderPath, JobType jobType, FolderMetadata metadata, String artistHint) {
    long now = clock.millis();
    FolderMetadata snapshot =
        metadata != null
            ? metadata
            : FolderMetadata.named(String.valueOf(Paths.get(folderPath).getFileName()));
    // insert-if-absent in one statement; the partial unique index backs it up
    int rows =
        jdbc.update(
            "INSERT INTO jobs (folder_path, job_type, status, metadata_json, artist_hint, revision,"
                + " created_at_ms, updated_at_ms)"
                + " SELECT ?, ?, 'queued', ?, ?, "
                + NEXT_REVISION
                + ", ?, ?"
                + " WHERE NOT EXISTS (SELECT 1 FROM jobs WHERE folder_path = ?)",
            folderPath,
            jobType.wireName(),
            toJson(snapshot),
            artistHint,
            now,
            now,
            folderPath);
    if (rows == 0) {
      return Optional.empty();
    }

    Optional<Job> created = findLatestByFolder(folderPath);
    created.ifPresent(job -> published(job.id(), folderPath, null, JobStatus.QUEUED));
    return created;
  }

  @Override
  public Optional<Job> claimNext(JobStatus from, JobStatus to) {
    requireEdge(from, to);
    while (true) {
      List<Long> candidates =
          jdbc.queryForList(
              "SELECT id FROM jobs WHERE status = ? ORDER BY id LIMIT ?",
              Long.class,
              from.wireName(),
              claimBatchSize);
      if (candidates.isEmpty()) {
        return Optional.empty();
      }
      for (Long id : candidates) {
        String token = newToken(to);
        if (compareAndSet(id, from, to, JobUpdate.none(), token, Guard.NONE)) {
          // empty only if the claim was lost again between the two statements
          Optional<Job> claimed =
              findById(id).filter(job -> Objects.equals(token, job.claimToken()));
          if (claimed.isPresent()) {
            return claimed;
          }
        }
      }
      // every candidate was taken by someone else; look again
    }
  }

  @Override
  public boolean transition(long id, JobStatus expected, JobStatus next, JobUpdate update) {
    requireEdge(expected, next);
    return compareAndSet(id, expected, next, update, newToken(next), Guard.NONE);
  }

  @Override
  public boolean completeClaim(Job claim, JobStatus next, JobUpdate update) {
    requireClaim(claim);
    requireEdge(claim.status(), next);
    return compareAndSet(
        claim.id(),
        claim.status(),
        next,
        update,
        newToken(next),
        new Guard("claim_token = ?", claim.claimToken()));
  }

  @Override
  public boolean transitionIfUnchanged(Job seen, JobStatus next, JobUpdate update) {
    requireEdge(seen.status(), next);
    return compareAndSet(
        seen.id(),
        seen.status(),
        next,
        update,
        newToken(next),
        new Guard("revision = ?", seen.revision()));
  }

  @Override
  public boolean updateMetadata(Job claim, FolderMetadata metadata) {
    requireClaim(claim);
    int rows =
        jdbc.update(
            "UPDATE jobs SET metadata_json = ?, updated_at_ms = ?, revision = "
                + NEXT_REVISION
                + " WHERE id = ? AND status = ? AND claim_token = ?",
            toJson(metadata),
            clock.millis(),
            claim.id(),
            claim.status().wireName(),
            claim.claimToken());
    return rows == 1;
  }

  @Override
  public Optional<Job> findById(long id) {
    return jdbc.query("SELECT " + COLUMNS + " FROM jobs WHERE id = ?", rowMapper, id).stream()
        .findFirst();
  }

  @Override
  public Optional<Job> findLatestByFolder(String folderPath) {
    return jdbc
        .query(
            "SELECT " + COLUMNS + " FROM jobs WHERE folder_path = ? ORDER BY id DESC LIMIT 1",
            rowMapper,
            folderPath)
        .stream()
        .findFirst();
  }

  @Override
  public List<Job> listByStatus(JobStatus status, int limit) {
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM jobs WHERE status = ? ORDER BY updated_at_ms DESC, id DESC"
            + " LIMIT ?",
        rowMapper,
        status.wireName(),
        limit);
  }

  @Override
  public List<Job> recent(int limit, JobStatus status) {
    if (status != null) {
      return listByStatus(status, limit);
    }
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM jobs ORDER BY updated_at_ms DESC, id DESC LIMIT ?",
        rowMapper,
        limit);
  }

  @Override
  public Map<JobStatus, Long> countByStatus() {
    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0L);
    }
    RowCallbackHandler collect =
        rs -> counts.put(JobStatus.fromWire(rs.getString("status")), rs.getLong("n"));
    jdbc.query("SELECT status, COUNT(1) AS n FROM jobs GROUP BY status", collect);
    return counts;
  }

  @Override
  public long currentRevision() {
    Long revision = jdbc.queryForObject("SELECT COALESCE(MAX(revision), 0) FROM jobs", Long.class);
    return revision == null ? 0L : revision;
  }

  @Override
  public int revertStale(JobStatus stuck, JobStatus back, Duration olderThan) {
    if (!stuck.isRecoveryEdge(back)) {
      throw new IllegalStateException("Not a recovery edge: " + stuck + " -> " + back);
    }
    long cutoff = clock.millis() - olderThan.toMillis();
    List<Long> stale =
        jdbc.queryForList(
            "SELECT id FROM jobs WHERE status = ? AND started_at_ms IS NOT NULL"
                + " AND started_at_ms < ? ORDER BY id",
            Long.class,
            stuck.wireName(),
            cutoff);

    int reverted = 0;
    for (Long id : stale) {
      // re-check the age so a job claimed afresh since the select is left alone
      if (compareAndSet(
          id, stuck, back, JobUpdate.none(), null, new Guard("started_at_ms < ?", cutoff))) {
        reverted++;
      }
    }
    if (reverted > 0) {
      structuredLogger.logStaleReverted(stuck.wireName(), back.wireName(), reverted);
    }
    return reverted;
  }

  private boolean compareAndSet(
      long id,
      JobStatus expected,
      JobStatus next,
      JobUpdate update,
      String claimToken,
      Guard guard) {
    long now = clock.millis();
    StringBuilder sql = new StringBuilder("UPDATE jobs SET status = ?");
    List<Object> args = new ArrayList<>();
    args.add(next.wireName());

    if (update.metadata() != null) {
      sql.append(", metadata_json = ?");
      args.add(toJson(update.metadata()));
    }

    if (next == JobStatus.QUEUED) {
      sql.append(", proposal_json = NULL");
    } else if (update.proposal() != null) {
      sql.append(", proposal_json = ?");
      args.add(toJson(update.proposal()));
    }

    if (next == JobStatus.ERROR) {
      sql.append(", error = ?");
      args.add(update.error() != null ? update.error() : "Unspecified failure");
    } else {
      sql.append(", error = NULL");
    }

    if (update.clearFeedback()) {
      sql.append(", feedback = NULL");
    } else if (update.feedback() != null) {
      sql.append(", feedback = ?");
      args.add(update.feedback());
    }

    if (next.isClaimed()) {
      sql.append(", started_at_ms = ?, claim_token = ?");
      args.add(now);
      args.add(claimToken);
    } else {
      sql.append(", started_at_ms = NULL, claim_token = NULL");
    }

    sql.append(", updated_at_ms = ?, revision = ").append(NEXT_REVISION);
    args.add(now);
    sql.append(" WHERE id = ? AND status = ?");
    args.add(id);
    args.add(expected.wireName());
    if (guard.clause() != null) {
      sql.append(" AND ").append(guard.clause());
      args.add(guard.value());
    }

    int rows = jdbc.update(sql.toString(), args.toArray());
    if (rows != 1) {
      structuredLogger.logClaimConflict(id, expected.wireName(), next.wireName());
      return false;
    }

    String folder =
        jdbc.queryForObject("SELECT folder_path FROM jobs WHERE id = ?", String.class, id);
    published(id, folder, expected, next);
    return true;
  }

  private void published(long id, String folder, JobStatus from, JobStatus to) {
    structuredLogger.logTransition(id, folder, from == null ? null : from.wireName(), to.wireName());
    events.publishEvent(new JobTransitionEvent(id, folder, from, to));
  }

  private static String newToken(JobStatus next) {
    return next.isClaimed() ? UUID.randomUUID().toString() : null;
  }

  private static void requireClaim(Job claim) {
    if (!claim.status().isClaimed() || claim.claimToken() == null) {
      throw new IllegalStateException("Job " + claim.id() + " is not held by a claim");
    }
  }

  private static void requireEdge(JobStatus from, JobStatus to) {
    if (!from.canTransitionTo(to)) {
      throw new IllegalStateException("Illegal transition: " + from + " -> " + to);
    }
  }

  private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
    long id = rs.getLong("id");
    return new Job(
        id,
        rs.getString("folder_path"),
        JobType.fromWire(rs.getString("job_type")),
        JobStatus.fromWire(rs.getString("status")),
        fromJson(rs.getString("metadata_json"), FolderMetadata.class, id),
        fromJson(rs.getString("proposal_json"), Proposal.class, id),
        rs.getString("error"),
        rs.getString("feedback"),
        rs.getString("artist_hint"),
        rs.getString("claim_token"),
        rs.getLong("revision"),
        Instant.ofEpochMilli(rs.getLong("created_at_ms")),
        Instant.ofEpochMilli(rs.getLong("updated_at_ms")));
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private <T> T fromJson(String json, Class<T> type, long jobId) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Corrupt " + type.getSimpleName() + " stored for job " + jobId, e);
    }
  }

  /** Extra condition on a compare-and-set; {@link #NONE} matches on id and status only. */
  private record Guard(String clause, Object value) {
    static final Guard NONE = new Guard(null, null);
  }
}
