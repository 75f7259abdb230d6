package com.scholary.sorter.job;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the store schema on startup.
 *
 * <p>Every statement is idempotent, so any number of processes may start against the same file.
 */
@Component
public class JobSchema {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobSchema.class);

  private final JdbcTemplate jdbc;
  private final JobStoreProperties properties;

  public JobSchema(JdbcTemplate jdbc, JobStoreProperties properties) {
    this.jdbc = jdbc;
    this.properties = properties;
  }

  @PostConstruct
  public void init() {
    initDirectories();
    apply(jdbc);
    LOGGER.info("Job store ready: dbPath={}", properties.dbPath());
  }

  private void initDirectories() {
    Path parent = Paths.get(properties.dbPath()).toAbsolutePath().getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create store directory: " + parent, e);
    }
  }

  /** Apply the schema through the given template. Also used directly by tests. */
  public static void apply(JdbcTemplate jdbc) {
    jdbc.execute(
        """
        CREATE TABLE IF NOT EXISTS jobs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            folder_path TEXT NOT NULL,
            job_type TEXT NOT NULL,
            status TEXT NOT NULL CHECK (status IN (%s)),
            metadata_json TEXT,
            proposal_json TEXT,
            error TEXT,
            feedback TEXT,
            artist_hint TEXT,
            claim_token TEXT,
            revision INTEGER NOT NULL,
            created_at_ms INTEGER NOT NULL,
            updated_at_ms INTEGER NOT NULL,
            started_at_ms INTEGER
        )
        """
            .formatted(inList(Arrays.asList(JobStatus.values()))));
    addColumnIfMissing(jdbc, "jobs", "claim_token", "TEXT");
    jdbc.execute(
        """
        CREATE TABLE IF NOT EXISTS settings (
            setting_key TEXT PRIMARY KEY,
            setting_value TEXT NOT NULL,
            updated_at_ms INTEGER NOT NULL
        )
        """);

    jdbc.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status, id)");
    jdbc.execute("CREATE INDEX IF NOT EXISTS idx_jobs_folder ON jobs(folder_path, id)");
    jdbc.execute("CREATE INDEX IF NOT EXISTS idx_jobs_revision ON jobs(revision)");
    jdbc.execute("CREATE INDEX IF NOT EXISTS idx_jobs_updated ON jobs(updated_at_ms, id)");
    // one non-terminal job per folder
    jdbc.execute(
        "CREATE UNIQUE INDEX IF NOT EXISTS idx_jobs_unique_active ON jobs(folder_path)"
            + " WHERE status IN ("
            + inList(JobStatus.nonTerminal())
            + ")");
  }

  /** Store files created before a column existed get it added in place. */
  private static void addColumnIfMissing(
      JdbcTemplate jdbc, String table, String column, String type) {
    if (hasColumn(jdbc, table, column)) {
      return;
    }
    try {
      jdbc.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
      LOGGER.info("Added column {}.{}", table, column);
    } catch (DataAccessException e) {
      // another process starting against the same file may have added it first
      if (!hasColumn(jdbc, table, column)) {
        throw e;
      }
    }
  }

  private static boolean hasColumn(JdbcTemplate jdbc, String table, String column) {
    Integer present =
        jdbc.queryForObject(
            "SELECT COUNT(1) FROM pragma_table_info(?) WHERE name = ?", Integer.class, table, column);
    return present != null && present > 0;
  }

  private static String inList(List<JobStatus> statuses) {
    return statuses.stream()
        .map(status -> "'" + status.wireName() + "'")
        .collect(Collectors.joining(","));
  }
}
