package com.scholary.sorter.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** A reviewer's decision on a proposal. */
public enum Verdict {
  ACCEPT,
  RECONSIDER,
  SKIP;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Verdict fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Verdict is required");
    }
    for (Verdict verdict : values()) {
      if (verdict.wireName().equalsIgnoreCase(value.trim())) {
        return verdict;
      }
    }
    throw new IllegalArgumentException("Unknown action: " + value);
  }
}
