package com.scholary.sorter.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Corrected metadata for a folder, produced by the analyzer or edited by a reviewer.
 *
 * <p>Every field is optional; {@code null} means "unknown".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Proposal(
    String artist,
    String album,
    String year,
    String releaseType,
    String confidence,
    String reasoning) {

  public static Proposal empty() {
    return new Proposal(null, null, null, null, null, null);
  }

  /**
   * Field-by-field merge: every non-null field of {@code override} replaces the corresponding
   * field of this proposal, everything else is kept verbatim.
   */
  public Proposal mergedWith(Proposal override) {
    if (override == null) {
      return this;
    }
    return new Proposal(
        pick(override.artist, artist),
        pick(override.album, album),
        pick(override.year, year),
        pick(override.releaseType, releaseType),
        pick(override.confidence, confidence),
        pick(override.reasoning, reasoning));
  }

  /** True when the proposal carries none of the fields that drive relocation. */
  @JsonIgnore
  public boolean isBlank() {
    return isBlank(artist) && isBlank(album) && isBlank(year) && isBlank(releaseType);
  }

  private static String pick(String preferred, String fallback) {
    return preferred != null ? preferred : fallback;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
