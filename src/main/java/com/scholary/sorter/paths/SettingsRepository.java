package com.scholary.sorter.paths;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/** Key/value settings kept next to the jobs in the store file. */
@Repository
@DependsOn("jobSchema")
public class SettingsRepository {

  private final JdbcTemplate jdbc;
  private final TransactionTemplate transactions;
  private final Clock clock;

  public SettingsRepository(JdbcTemplate jdbc, TransactionTemplate transactions, Clock clock) {
    this.jdbc = jdbc;
    this.transactions = transactions;
    this.clock = clock;
  }

  public Map<String, String> findAll() {
    Map<String, String> settings = new HashMap<>();
    RowCallbackHandler collect =
        rs -> settings.put(rs.getString("setting_key"), rs.getString("setting_value"));
    jdbc.query("SELECT setting_key, setting_value FROM settings", collect);
    return settings;
  }

  /** Write all entries in one transaction; {@code null} values delete the key. */
  public void saveAll(Map<String, String> entries) {
    long now = clock.millis();
    transactions.executeWithoutResult(
        status ->
            entries.forEach(
                (key, value) -> {
                  if (value == null) {
                    jdbc.update("DELETE FROM settings WHERE setting_key = ?", key);
                  } else {
                    jdbc.update(
                        "INSERT INTO settings (setting_key, setting_value, updated_at_ms)"
                            + " VALUES (?, ?, ?)"
                            + " ON CONFLICT(setting_key) DO UPDATE SET"
                            + " setting_value = excluded.setting_value,"
                            + " updated_at_ms = excluded.updated_at_ms",
                        key,
                        value,
                        now);
                  }
                }));
  }
}
