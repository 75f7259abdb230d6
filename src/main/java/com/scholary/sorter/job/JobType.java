package com.scholary.sorter.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which stage produced the record. Informational only; transitions are driven by {@link JobStatus}.
 */
public enum JobType {
  SCAN_DISCOVERED("scan-discovered"),
  ANALYZE("analyze"),
  MOVE("move");

  private final String wireName;

  JobType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static JobType fromWire(String value) {
    for (JobType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown job type: " + value);
  }
}
